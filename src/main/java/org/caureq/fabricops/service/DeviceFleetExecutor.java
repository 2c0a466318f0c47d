package org.caureq.fabricops.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.domain.ApplyErrorKind;
import org.caureq.fabricops.domain.ApplyResult;
import org.caureq.fabricops.domain.FleetTarget;
import org.caureq.fabricops.service.device.DeviceExecutor;
import org.caureq.fabricops.service.error.DeviceRejectedException;
import org.caureq.fabricops.service.error.DeviceTimeoutException;
import org.caureq.fabricops.service.error.DeviceUnreachableException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Pushes committed artifacts to devices in parallel.
 * <ul>
 *   <li>units run on the shared {@code fleetWorkers} pool, at most {@code concurrencyLimit} per dispatch;</li>
 *   <li>each unit has its own timeout, counted from the moment it starts, enforced by interrupting it;</li>
 *   <li>a unit failure ends up in its own {@link ApplyResult} and never stops siblings;</li>
 *   <li>results come back in completion order.</li>
 * </ul>
 */
@Service
@Slf4j
public class DeviceFleetExecutor {
    private final DeviceExecutor devices;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;

    public DeviceFleetExecutor(DeviceExecutor devices,
                               @Qualifier("fleetWorkers") ExecutorService workers,
                               @Qualifier("fleetWatchdog") ScheduledExecutorService watchdog) {
        this.devices = devices;
        this.workers = workers;
        this.watchdog = watchdog;
    }

    /** Blocking variant of {@link #dispatch}. */
    public List<ApplyResult> apply(Collection<FleetTarget> targets, int concurrencyLimit, Duration perDeviceTimeout) {
        return dispatch(targets, concurrencyLimit, perDeviceTimeout).join();
    }

    public CompletableFuture<List<ApplyResult>> dispatch(Collection<FleetTarget> targets, int concurrencyLimit,
                                                         Duration perDeviceTimeout) {
        return dispatch(targets, concurrencyLimit, perDeviceTimeout, r -> { });
    }

    /**
     * The returned future never completes exceptionally: failures are inside the results.
     *
     * @param onResult called once per unit, as soon as that unit ends, on the thread that ran it;
     *                 an exception thrown by it is logged and does not affect the dispatch
     */
    public CompletableFuture<List<ApplyResult>> dispatch(Collection<FleetTarget> targets, int concurrencyLimit,
                                                         Duration perDeviceTimeout, Consumer<ApplyResult> onResult) {
        if (concurrencyLimit < 1) throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        if (perDeviceTimeout == null || perDeviceTimeout.isZero() || perDeviceTimeout.isNegative()) {
            throw new IllegalArgumentException("perDeviceTimeout must be positive");
        }
        log.info("[Fleet] dispatch {} target(s) limit={} timeout={}ms",
                targets.size(), concurrencyLimit, perDeviceTimeout.toMillis());
        var run = new Dispatch(List.copyOf(targets), perDeviceTimeout, onResult);
        run.start(concurrencyLimit);
        return run.done;
    }

    private final class Dispatch {
        private final Iterator<FleetTarget> pending;
        private final int total;
        private final Duration timeout;
        private final Consumer<ApplyResult> onResult;
        private final Queue<ApplyResult> results = new ConcurrentLinkedQueue<>();
        private final AtomicInteger finished = new AtomicInteger();
        private final CompletableFuture<List<ApplyResult>> done = new CompletableFuture<>();

        Dispatch(List<FleetTarget> targets, Duration timeout, Consumer<ApplyResult> onResult) {
            this.pending = targets.iterator();
            this.total = targets.size();
            this.timeout = timeout;
            this.onResult = onResult;
        }

        void start(int lanes) {
            if (total == 0) {
                done.complete(List.of());
                return;
            }
            for (int i = 0; i < Math.min(lanes, total); i++) launchNext();
        }

        /* a lane picks the next target when its previous unit ends */
        void launchNext() {
            FleetTarget t;
            synchronized (this) {
                if (!pending.hasNext()) return;
                t = pending.next();
            }
            CompletableFuture<ApplyResult> unit;
            try {
                unit = CompletableFuture.supplyAsync(() -> runUnit(t, timeout), workers);
            } catch (RejectedExecutionException e) {
                unit = CompletableFuture.completedFuture(
                        ApplyResult.failed(t, ApplyErrorKind.INTERNAL, "worker pool rejected the unit", Duration.ZERO));
            }
            unit.whenComplete((r, ex) -> {
                var result = r != null ? r
                        : ApplyResult.failed(t, ApplyErrorKind.INTERNAL, String.valueOf(ex), Duration.ZERO);
                try {
                    onResult.accept(result);
                } catch (RuntimeException e) {
                    log.error("[Fleet] result listener failed for {} commit={}", result.device(), result.commitId(), e);
                }
                results.add(result);
                if (finished.incrementAndGet() == total) done.complete(List.copyOf(results));
                else launchNext();
            });
        }
    }

    private ApplyResult runUnit(FleetTarget t, Duration timeout) {
        long start = System.nanoTime();
        var guard = new Guard(Thread.currentThread());
        ScheduledFuture<?> dog = watchdog.schedule(guard::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
        var name = t.device().name();
        try {
            devices.applyCommands(t.device(), t.artifact().lines(), timeout);
            log.debug("[Fleet] {} commit={} applied in {}ms", name, t.commitId(), since(start).toMillis());
            return ApplyResult.ok(t, since(start));
        } catch (DeviceRejectedException e) {
            log.warn("[Fleet] {} commit={} rejected: {}", name, t.commitId(), e.reason());
            return ApplyResult.failed(t, ApplyErrorKind.REJECTED, e.reason(), since(start));
        } catch (DeviceTimeoutException e) {
            log.warn("[Fleet] {} commit={} timed out", name, t.commitId());
            return ApplyResult.failed(t, ApplyErrorKind.TIMEOUT, e.getMessage(), since(start));
        } catch (DeviceUnreachableException e) {
            if (guard.expired()) return timedOut(t, timeout, start);
            log.warn("[Fleet] {} commit={} unreachable: {}", name, t.commitId(), e.getMessage());
            return ApplyResult.failed(t, ApplyErrorKind.UNREACHABLE, e.getMessage(), since(start));
        } catch (RuntimeException e) {
            if (guard.expired()) return timedOut(t, timeout, start);
            log.error("[Fleet] {} commit={} failed unexpectedly", name, t.commitId(), e);
            return ApplyResult.failed(t, ApplyErrorKind.INTERNAL, String.valueOf(e.getMessage()), since(start));
        } finally {
            dog.cancel(false);
            guard.finish();
        }
    }

    private ApplyResult timedOut(FleetTarget t, Duration timeout, long start) {
        log.warn("[Fleet] {} commit={} timed out after {}ms", t.device().name(), t.commitId(), timeout.toMillis());
        return ApplyResult.failed(t, ApplyErrorKind.TIMEOUT,
                "no answer from %s within %d ms".formatted(t.device().name(), timeout.toMillis()), since(start));
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** Interrupts the worker on expiry; once finished, no interrupt can leak into the next unit. */
    private static final class Guard {
        private final Thread worker;
        private boolean finished;
        private boolean expired;

        Guard(Thread worker) { this.worker = worker; }

        synchronized void expire() {
            if (!finished) {
                expired = true;
                worker.interrupt();
            }
        }

        synchronized boolean expired() { return expired; }

        synchronized void finish() {
            finished = true;
            Thread.interrupted();
        }
    }
}
