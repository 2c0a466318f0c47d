package org.caureq.fabricops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.fabricops.domain.ApplyStatus;
import org.caureq.fabricops.domain.CommitKind;
import org.caureq.fabricops.domain.HistoryEntry;

import java.time.Instant;

public record HistoryItemDTO(String commitHash, String message, Instant timestamp, String author,
                             String device, @JsonProperty("interface") String iface,
                             String parent, CommitKind kind, ApplyStatus applyStatus) {
    public static HistoryItemDTO of(HistoryEntry e) {
        var r = e.record();
        return new HistoryItemDTO(r.commitId(), r.message(), r.committedAt(), r.author(), r.device(), r.iface(),
                r.parentCommitId(), r.kind(), e.applyStatus());
    }
}
