package org.caureq.fabricops.domain;

/** A commit together with what the apply log knows about it. */
public record HistoryEntry(AuditRecord record, ApplyStatus applyStatus) {}
