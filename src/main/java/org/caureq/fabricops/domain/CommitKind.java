package org.caureq.fabricops.domain;

public enum CommitKind { CHANGE, ROLLBACK }
