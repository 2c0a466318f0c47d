package org.caureq.fabricops.api.dto;

import org.caureq.fabricops.domain.ApplyLog;
import org.caureq.fabricops.domain.HistoryEntry;

import java.time.Instant;
import java.util.List;

/** One commit with its full configuration text and every apply attempt, newest first. */
public record CommitDetailDTO(HistoryItemDTO summary, String sourceCommit, Instant synthesizedAt, String config,
                              List<ApplyAttemptDTO> attempts) {
    public static CommitDetailDTO of(HistoryEntry e, List<ApplyLog> attempts) {
        var r = e.record();
        return new CommitDetailDTO(HistoryItemDTO.of(e), r.sourceCommitId(), r.artifact().synthesizedAt(),
                r.artifact().text(), attempts.stream().map(ApplyAttemptDTO::of).toList());
    }
}
