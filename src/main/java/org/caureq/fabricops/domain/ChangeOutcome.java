package org.caureq.fabricops.domain;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of a committed change. The commits stay in history whatever the apply outcome was:
 * history is an intent log, the apply results tell what the network actually accepted.
 */
public record ChangeOutcome(ChangeState state, List<AuditRecord> commits, List<ApplyResult> results) {

    public ChangeOutcome {
        commits = List.copyOf(commits);
        results = List.copyOf(results);
    }

    public boolean success() { return state == ChangeState.SUCCEEDED; }

    public AuditRecord primaryCommit() { return commits.isEmpty() ? null : commits.get(0); }

    public List<ApplyResult> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }

    /** Results keyed by commit id (one unit per commit). */
    public Map<String, ApplyResult> byCommit() {
        return results.stream().collect(Collectors.toMap(ApplyResult::commitId, Function.identity(), (a, b) -> b));
    }

    public static ChangeState stateOf(List<ApplyResult> results) {
        return results.stream().allMatch(ApplyResult::success) ? ChangeState.SUCCEEDED : ChangeState.FAILED;
    }
}
