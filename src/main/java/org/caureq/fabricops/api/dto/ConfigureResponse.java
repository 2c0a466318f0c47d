package org.caureq.fabricops.api.dto;

import org.caureq.fabricops.domain.ApplyResult;
import org.caureq.fabricops.domain.AuditRecord;
import org.caureq.fabricops.domain.ChangeOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Body of configure / rollback. {@code stage} is null on success and "apply" otherwise;
 * {@code failedDevices} and {@code succeededDevices} say who accepted the change.
 */
public record ConfigureResponse(
        boolean success,
        String state,
        String stage,
        String commitHash,
        List<String> commitHashes,
        String appliedConfig,
        Instant timestamp,
        String message,
        List<String> succeededDevices,
        List<String> failedDevices,
        List<ApplyResultDTO> results
) {
    public static ConfigureResponse of(ChangeOutcome o, String verb) {
        var primary = o.primaryCommit();
        var ok = o.results().stream().filter(ApplyResult::success).map(ApplyResult::device).distinct().sorted().toList();
        var ko = o.failures().stream().map(ApplyResult::device).distinct().sorted().toList();
        String message;
        if (o.success()) {
            message = o.commits().size() == 1
                    ? "Successfully %s %s on %s".formatted(verb, primary.iface(), primary.device())
                    : "Successfully %s %d port(s)".formatted(verb, o.commits().size());
        } else {
            message = "Apply failed on %s; commit(s) kept in history, roll back explicitly if needed".formatted(ko);
        }
        return new ConfigureResponse(
                o.success(),
                o.state().name(),
                o.success() ? null : "apply",
                primary == null ? null : primary.commitId(),
                o.commits().stream().map(AuditRecord::commitId).toList(),
                primary == null ? null : primary.artifact().text(),
                primary == null ? Instant.now() : primary.committedAt(),
                message,
                ok, ko,
                o.results().stream().map(ApplyResultDTO::of).toList());
    }
}
