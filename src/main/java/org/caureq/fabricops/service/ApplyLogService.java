package org.caureq.fabricops.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.domain.ApplyLog;
import org.caureq.fabricops.domain.ApplyResult;
import org.caureq.fabricops.domain.ApplyStatus;
import org.caureq.fabricops.repo.ApplyLogRepo;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

/**
 * Outcome log kept next to the audit history: the history says what was intended,
 * this says what each device accepted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplyLogService {
    private final ApplyLogRepo repo;
    private final Clock clock;

    /** Called from fan-out workers; a failed write is logged, the result still reaches the caller. */
    public void record(ApplyResult r, String author) {
        try {
            repo.save(ApplyLog.builder()
                    .commitId(r.commitId()).device(r.device()).iface(r.iface())
                    .success(r.success()).errorKind(r.errorKind()).errorDetail(truncate(r.errorDetail()))
                    .durationMs(r.duration() == null ? 0 : r.duration().toMillis())
                    .author(author)
                    .ts(clock.instant())
                    .build());
        } catch (DataAccessException e) {
            log.error("[ApplyLog] could not record outcome of commit {} on {}: {}", r.commitId(), r.device(), e.getMessage(), e);
        }
    }

    public ApplyStatus status(String commitId) {
        return statuses(List.of(commitId)).getOrDefault(commitId, ApplyStatus.PENDING);
    }

    /** Latest attempt per device decides; any failed device makes the commit FAILED. */
    public Map<String, ApplyStatus> statuses(Collection<String> commitIds) {
        if (commitIds.isEmpty()) return Map.of();
        Map<String, Map<String, ApplyLog>> latest = new HashMap<>();
        for (var l : repo.findByCommitIdIn(commitIds)) {
            latest.computeIfAbsent(l.getCommitId(), k -> new HashMap<>())
                    .merge(l.getDevice(), l, (a, b) -> a.getTs().isAfter(b.getTs()) ? a : b);
        }
        Map<String, ApplyStatus> out = new HashMap<>();
        for (var id : commitIds) {
            var perDevice = latest.get(id);
            if (perDevice == null || perDevice.isEmpty()) out.put(id, ApplyStatus.PENDING);
            else out.put(id, perDevice.values().stream().allMatch(ApplyLog::isSuccess) ? ApplyStatus.SUCCEEDED : ApplyStatus.FAILED);
        }
        return out;
    }

    public List<ApplyLog> attempts(String commitId) {
        return repo.findByCommitIdOrderByTsDesc(commitId);
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
