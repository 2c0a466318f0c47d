package org.caureq.fabricops.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Persistent row of the audit log. Inserted once, never updated. */
@Entity
@Table(name = "audit_commits", indexes = {
        @Index(name = "idx_commit_seq", columnList = "seq DESC"),
        @Index(name = "idx_commit_dev_seq", columnList = "device, seq DESC"),
        @Index(name = "idx_commit_dev_if_seq", columnList = "device, interface_name, seq DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AuditCommit {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "commit_id", nullable = false, unique = true, length = 64)
    private String commitId;

    @Column(nullable = false, unique = true)
    private long seq;

    @Column(nullable = false, length = 128)
    private String device;

    @Column(name = "interface_name", nullable = false, length = 64)
    private String iface;

    @Column(nullable = false, length = 128)
    private String author;

    @Column(nullable = false)
    private Instant committedAt;

    @Column(length = 64)
    private String parentCommitId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CommitKind kind;

    @Column(length = 64)
    private String sourceCommitId;   // rollback target, null for CHANGE

    @Column(nullable = false)
    private Instant synthesizedAt;

    @Column(nullable = false, length = 32000)
    private String configText;       // full rendered config, no diffs

    @Column(nullable = false, length = 64)
    private String digest;           // sha-256 hex over the fields above
}
