package org.caureq.fabricops.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.*;
import org.caureq.fabricops.service.error.*;
import org.caureq.fabricops.service.inventory.InventorySource;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ExecutionException;

/**
 * End-to-end port change: pre-check gate, synthesis, commit, fan-out apply.
 * <p>
 * The commit is written before anything is pushed, so history is an <em>intent log</em>: a commit
 * whose apply failed stays in history, and its outcome is in the apply log. Nothing is rolled back
 * or retried automatically; callers decide from the per-device results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeOrchestrator {
    private final InventorySource inventory;
    private final PreCheckEngine precheck;
    private final ConfigSynthesizer synthesizer;
    private final AuditStore audit;
    private final DeviceFleetExecutor fleet;
    private final ApplyLogService applyLog;
    private final FabricProps props;

    public PreCheckResult precheck(String device, String iface) {
        return precheck.check(device, iface);
    }

    public PreCheckResult precheck(ChangeRequest request) {
        return precheck.check(request);
    }

    /**
     * @throws UnsafeToConfigureException pre-check veto, nothing committed
     * @throws ChangeCancelledException caller interrupted before commit (no side effect) or while applying
     */
    public ChangeOutcome configure(ChangeRequest request, String author) {
        return configureAll(List.of(request), author);
    }

    /**
     * Multi-port change. Every port is pre-checked before the first commit: one unsafe port
     * rejects the whole batch. Then all artifacts fan out in a single dispatch.
     */
    public ChangeOutcome configureAll(List<ChangeRequest> requests, String author) {
        if (requests == null || requests.isEmpty()) throw new ConfigValidationException("no change requested");

        List<ChangeRequest> changes = new ArrayList<>();
        Map<String, DeviceDescriptor> descriptors = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (var r : requests) {
            var d = inventory.resolve(r.device());
            var canonical = r.device().equals(d.name()) ? r : r.toBuilder().device(d.name()).build();
            if (!seen.add(d.name() + "|" + canonical.iface())) {
                throw new ConfigValidationException("duplicate change for " + d.name() + " " + canonical.iface());
            }
            descriptors.put(d.name(), d);
            changes.add(canonical);
            transition(canonical, ChangeState.RECEIVED);
        }

        for (var c : changes) {
            var result = precheck.check(c);
            if (!result.safe()) {
                transition(c, ChangeState.REJECTED);
                log.warn("[Change] {} {} rejected by pre-check: {}", c.device(), c.iface(), result.recommendations());
                throw new UnsafeToConfigureException(result);
            }
            transition(c, ChangeState.PRECHECKED);
        }

        // tout est rendu avant le premier commit: une erreur de rendu ne laisse aucune trace
        List<ConfigurationArtifact> artifacts = changes.stream().map(synthesizer::render).toList();

        checkCancelled(changes.get(0).device());
        List<AuditRecord> commits = new ArrayList<>();
        List<FleetTarget> targets = new ArrayList<>();
        for (int i = 0; i < changes.size(); i++) {
            var c = changes.get(i);
            var rec = audit.commit(c.device(), c.iface(), artifacts.get(i), author);
            transition(c, ChangeState.COMMITTED);
            commits.add(rec);
            targets.add(new FleetTarget(descriptors.get(c.device()), rec.commitId(), rec.artifact()));
        }
        return applyCommitted(commits, targets, author);
    }

    /**
     * Restores the content of {@code commitId} as a new ROLLBACK commit and pushes it.
     * No MAC gate here: rolling back is an explicit operator decision to return to a known state.
     */
    public ChangeOutcome rollback(String commitId, String author) {
        var target = audit.find(commitId).orElseThrow(() -> new CommitNotFoundException(Stage.ROLLBACK, commitId));
        var descriptor = inventory.resolve(target.device());
        checkCancelled(target.device());
        var rec = audit.rollback(target.commitId(), author);
        log.info("[Change] rollback {} {} to {} as commit {}", rec.device(), rec.iface(), target.commitId(), rec.commitId());
        return applyCommitted(List.of(rec), List.of(new FleetTarget(descriptor, rec.commitId(), rec.artifact())), author);
    }

    /* --------------------- history --------------------- */

    public List<HistoryEntry> history(String device, String iface, int limit) {
        var name = (device == null || device.isBlank()) ? null : inventory.resolve(device).name();
        int bounded = Math.max(1, Math.min(limit, props.maxHistoryLimit()));
        var records = audit.history(name, name == null ? null : iface, bounded);
        var statuses = applyLog.statuses(records.stream().map(AuditRecord::commitId).toList());
        return records.stream()
                .map(r -> new HistoryEntry(r, statuses.getOrDefault(r.commitId(), ApplyStatus.PENDING)))
                .toList();
    }

    public HistoryEntry show(String commitId) {
        var rec = audit.find(commitId).orElseThrow(() -> new CommitNotFoundException(Stage.HISTORY, commitId));
        return new HistoryEntry(rec, applyLog.status(rec.commitId()));
    }

    public List<ApplyLog> attempts(String commitId) {
        return applyLog.attempts(commitId);
    }

    public boolean storeHealthy() {
        return audit.healthy();
    }

    public List<DeviceDescriptor> devices() {
        return inventory.list();
    }

    /* --------------------- internals --------------------- */

    private ChangeOutcome applyCommitted(List<AuditRecord> commits, List<FleetTarget> targets, String author) {
        // chaque unité est journalisée dès qu'elle se termine, même si l'appelant n'attend plus
        var pending = fleet.dispatch(targets, props.concurrencyLimit(), props.perDeviceTimeout(),
                r -> applyLog.record(r, author));

        List<ApplyResult> results;
        try {
            results = pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var ids = String.join(",", commits.stream().map(AuditRecord::commitId).toList());
            log.warn("[Change] caller stopped waiting for commit(s) {}, apply continues in background", ids);
            throw new ChangeCancelledException(Stage.APPLY, commits.get(0).device(), ids);
        } catch (ExecutionException e) {
            throw new IllegalStateException("fan-out failed unexpectedly", e.getCause());
        }

        var outcome = new ChangeOutcome(ChangeOutcome.stateOf(results), commits, results);
        var byCommit = outcome.byCommit();
        for (var c : commits) {
            var r = byCommit.get(c.commitId());
            transition(c.device(), c.iface(), ChangeState.APPLIED);
            transition(c.device(), c.iface(), r != null && r.success() ? ChangeState.SUCCEEDED : ChangeState.FAILED);
        }
        if (outcome.state() == ChangeState.FAILED) {
            log.warn("[Change] apply failed on {}", results.stream().filter(r -> !r.success())
                    .map(r -> r.device() + " " + r.iface() + " (" + r.errorKind() + ")").toList());
        }
        return outcome;
    }

    private void checkCancelled(String device) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ChangeCancelledException(Stage.COMMIT, device, null);
        }
    }

    private void transition(ChangeRequest r, ChangeState to) {
        transition(r.device(), r.iface(), to);
    }

    private void transition(String device, String iface, ChangeState to) {
        log.debug("[Change] {} {} -> {}{}", device, iface, to, to.terminal() ? " (final)" : "");
    }
}
