package org.caureq.fabricops.domain;

import java.time.Instant;

/**
 * Immutable commit in the configuration history of one (device, interface).
 * {@code parentCommitId} is the previous head of that pair, null for the first commit.
 */
public record AuditRecord(String commitId,
                          long sequence,
                          String device,
                          String iface,
                          ConfigurationArtifact artifact,
                          String author,
                          Instant committedAt,
                          String parentCommitId,
                          CommitKind kind,
                          String sourceCommitId) {

    public String message() {
        return kind == CommitKind.ROLLBACK
                ? "Rollback %s %s to %s".formatted(device, iface, sourceCommitId)
                : "Configure %s %s".formatted(device, iface);
    }
}
