package org.caureq.fabricops.domain;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;

@Entity @Table(name = "apply_log", indexes = {
        @Index(name = "idx_apply_commit_ts", columnList = "commit_id, ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ApplyLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(name = "commit_id", nullable = false, length = 64)
    private String commitId;
    private String device;
    @Column(name = "interface_name")
    private String iface;
    private boolean success;
    @Enumerated(EnumType.STRING)
    private ApplyErrorKind errorKind;
    @Column(length = 2000)
    private String errorDetail;   // message du device / timeout...
    private long durationMs;
    private String author;
    private Instant ts;
}
