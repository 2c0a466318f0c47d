package org.caureq.fabricops.service;

import org.caureq.fabricops.Fixtures;
import org.caureq.fabricops.domain.*;
import org.caureq.fabricops.service.device.DeviceExecutor;
import org.caureq.fabricops.service.error.*;
import org.caureq.fabricops.service.inventory.ConfiguredInventorySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChangeOrchestratorTest {
    @Mock DeviceExecutor devices;
    @Mock AuditStore audit;
    @Mock ApplyLogService applyLog;

    private final ExecutorService workers = Executors.newFixedThreadPool(4);
    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor();
    private final AtomicInteger ids = new AtomicInteger();
    private ChangeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestrator(new NxosConfigRenderer());
    }

    private ChangeOrchestrator orchestrator(ConfigRenderer renderer) {
        var props = Fixtures.props();
        var inventory = new ConfiguredInventorySource(props);
        return new ChangeOrchestrator(inventory,
                new PreCheckEngine(inventory, devices, props),
                new ConfigSynthesizer(renderer, Fixtures.CLOCK),
                audit,
                new DeviceFleetExecutor(devices, workers, watchdog),
                applyLog,
                props);
    }

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        workers.shutdownNow();
        watchdog.shutdownNow();
    }

    @Test
    void safeChangeIsCheckedCommittedThenApplied() {
        when(devices.readState(any(), eq("Eth1/1"), any())).thenReturn(Fixtures.idlePort());
        stubCommits();

        var outcome = orchestrator.configure(Fixtures.serverLink(), "alice");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.state()).isEqualTo(ChangeState.SUCCEEDED);
        var commit = outcome.primaryCommit();
        assertThat(commit.author()).isEqualTo("alice");
        assertThat(commit.artifact().lines()).contains("  description Server Link", "  switchport access vlan 10");
        assertThat(outcome.results()).singleElement()
                .satisfies(r -> assertThat(r.commitId()).isEqualTo(commit.commitId()));

        InOrder order = inOrder(devices, audit);
        order.verify(devices).readState(any(), eq("Eth1/1"), any());
        order.verify(audit).commit(eq("leaf-01"), eq("Eth1/1"), any(), eq("alice"));
        order.verify(devices).applyCommands(any(), eq(commit.artifact().lines()), any());
        verify(applyLog).record(argThat(ApplyResult::success), eq("alice"));
    }

    @Test
    void liveTrafficVetoesTheChangeBeforeAnyCommit() {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.livePort("aa:bb:cc:dd:ee:ff"));

        assertThatThrownBy(() -> orchestrator.configure(Fixtures.serverLink(), "alice"))
                .isInstanceOf(UnsafeToConfigureException.class)
                .satisfies(e -> assertThat(((UnsafeToConfigureException) e).precheck().learnedMacAddresses())
                        .containsExactly("aa:bb:cc:dd:ee:ff"));

        verifyNoInteractions(audit, applyLog);
        verify(devices, never()).applyCommands(any(), any(), any());
    }

    @Test
    void failedApplyKeepsTheCommitAndReportsTheDevice() {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        stubCommits();
        doThrow(new DeviceRejectedException("leaf-01", "% Invalid command at '^' marker"))
                .when(devices).applyCommands(any(), anyList(), any());

        var outcome = orchestrator.configure(Fixtures.serverLink(), "alice");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.commits()).hasSize(1);
        assertThat(outcome.failures()).singleElement().satisfies(r -> {
            assertThat(r.device()).isEqualTo("leaf-01");
            assertThat(r.errorKind()).isEqualTo(ApplyErrorKind.REJECTED);
        });
        verify(audit, never()).rollback(anyString(), anyString());
        verify(devices, times(1)).applyCommands(any(), anyList(), any());
        verify(applyLog).record(argThat(r -> !r.success()), eq("alice"));
    }

    @Test
    void oneUnsafePortRejectsTheWholeBatch() {
        when(devices.readState(any(), eq("Eth1/1"), any())).thenReturn(Fixtures.idlePort());
        when(devices.readState(any(), eq("Eth1/2"), any())).thenReturn(Fixtures.livePort("02:00:00:00:00:01"));
        var second = Fixtures.serverLink().toBuilder().device("leaf-02").iface("Eth1/2").build();

        assertThatThrownBy(() -> orchestrator.configureAll(List.of(Fixtures.serverLink(), second), "alice"))
                .isInstanceOf(UnsafeToConfigureException.class)
                .hasMessageContaining("leaf-02");

        verifyNoInteractions(audit);
    }

    @Test
    void bulkChangeFansOutOneUnitPerCommit() {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        stubCommits();
        var second = Fixtures.serverLink().toBuilder().device("LEAF-02").build();

        var outcome = orchestrator.configureAll(List.of(Fixtures.serverLink(), second), "alice");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.commits()).extracting(AuditRecord::device).containsExactly("leaf-01", "leaf-02");
        assertThat(outcome.byCommit()).hasSize(2);
    }

    @Test
    void oversizedItemAbortsTheBatchBeforeAnyCommit() {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        var nxos = new NxosConfigRenderer();
        ConfigRenderer bloatedOnLeaf02 = r -> {
            if (!r.device().equals("leaf-02")) return nxos.render(r);
            var lines = new ArrayList<>(nxos.render(r));
            lines.addAll(Collections.nCopies(2_000, "  description xxxxxxxxxxxxxxxxxx"));
            return lines;
        };
        var second = Fixtures.serverLink().toBuilder().device("leaf-02").build();

        assertThatThrownBy(() -> orchestrator(bloatedOnLeaf02)
                .configureAll(List.of(Fixtures.serverLink(), second), "alice"))
                .isInstanceOf(ConfigValidationException.class)
                .satisfies(e -> assertThat(((ConfigValidationException) e).stage()).isEqualTo(Stage.SYNTHESIS));

        verifyNoInteractions(audit, applyLog);
        verify(devices, never()).applyCommands(any(), any(), any());
    }

    @Test
    void fastDeviceIsRecordedWhileASiblingIsStillApplying() throws Exception {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        stubCommits();
        var release = new CountDownLatch(1);
        doAnswer(inv -> {
            DeviceDescriptor d = inv.getArgument(0);
            if (d.name().equals("leaf-02")) release.await();
            return null;
        }).when(devices).applyCommands(any(), anyList(), any());
        var second = Fixtures.serverLink().toBuilder().device("leaf-02").build();

        var caller = CompletableFuture.supplyAsync(
                () -> orchestrator.configureAll(List.of(Fixtures.serverLink(), second), "alice"));

        verify(applyLog, timeout(1_500)).record(argThat(r -> r.device().equals("leaf-01")), eq("alice"));
        verify(applyLog, never()).record(argThat(r -> r.device().equals("leaf-02")), any());
        assertThat(caller).isNotDone();

        release.countDown();
        assertThat(caller.get(2, TimeUnit.SECONDS).success()).isTrue();
        verify(applyLog).record(argThat(r -> r.device().equals("leaf-02")), eq("alice"));
    }

    @Test
    void interruptAfterCommitReportsTheCommitAndStillRecordsTheOutcome() throws Exception {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        stubCommits();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        doAnswer(inv -> {
            entered.countDown();
            release.await();
            return null;
        }).when(devices).applyCommands(any(), anyList(), any());
        var failure = new AtomicReference<Throwable>();

        var caller = new Thread(() -> {
            try {
                orchestrator.configure(Fixtures.serverLink(), "alice");
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        caller.start();
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2_000);

        assertThat(failure.get()).isInstanceOf(ChangeCancelledException.class);
        var cancelled = (ChangeCancelledException) failure.get();
        assertThat(cancelled.commitId()).isEqualTo("c000001");
        assertThat(cancelled.stage()).isEqualTo(Stage.APPLY);
        verify(applyLog, never()).record(any(), any());

        release.countDown();
        verify(applyLog, timeout(1_500)).record(argThat(r -> r.commitId().equals("c000001") && r.success()), eq("alice"));
    }

    @Test
    void duplicatePortInOneBatchIsInvalid() {
        var dup = Fixtures.serverLink().toBuilder().device("Leaf-01").build();

        assertThatThrownBy(() -> orchestrator.configureAll(List.of(Fixtures.serverLink(), dup), "alice"))
                .isInstanceOf(ConfigValidationException.class);
        verifyNoInteractions(devices, audit);
    }

    @Test
    void unknownDeviceIsNotFound() {
        var request = Fixtures.serverLink().toBuilder().device("leaf-99").build();

        assertThatThrownBy(() -> orchestrator.configure(request, "alice")).isInstanceOf(DeviceNotFoundException.class);
        verifyNoInteractions(devices, audit);
    }

    @Test
    void interruptBeforeCommitLeavesNoTrace() {
        when(devices.readState(any(), any(), any())).thenReturn(Fixtures.idlePort());
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> orchestrator.configure(Fixtures.serverLink(), "alice"))
                .isInstanceOf(ChangeCancelledException.class)
                .satisfies(e -> assertThat(((ChangeCancelledException) e).commitId()).isNull());
        assertThat(Thread.interrupted()).isTrue();

        verifyNoInteractions(audit);
        verify(devices, never()).applyCommands(any(), any(), any());
    }

    @Test
    void rollbackPushesTheRestoredConfigurationWithoutAMacGate() {
        var old = record("abc1234", Fixtures.artifact("leaf-01", "Eth1/1", 10), CommitKind.CHANGE, null);
        var restored = record("def5678", old.artifact(), CommitKind.ROLLBACK, "abc1234");
        when(audit.find("abc1234")).thenReturn(Optional.of(old));
        when(audit.rollback("abc1234", "bob")).thenReturn(restored);

        var outcome = orchestrator.rollback("abc1234", "bob");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.primaryCommit().kind()).isEqualTo(CommitKind.ROLLBACK);
        verify(devices).applyCommands(any(), eq(old.artifact().lines()), any());
        verify(devices, never()).readState(any(), any(), any());
    }

    @Test
    void rollbackToUnknownCommitIsNotFound() {
        when(audit.find("nope123")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.rollback("nope123", "bob"))
                .isInstanceOf(CommitNotFoundException.class)
                .satisfies(e -> assertThat(((CommitNotFoundException) e).stage()).isEqualTo(Stage.ROLLBACK));
        verifyNoInteractions(devices);
    }

    @Test
    void historyCarriesApplyStatus() {
        var c = record("abc1234", Fixtures.artifact("leaf-01", "Eth1/1", 10), CommitKind.CHANGE, null);
        when(audit.history("leaf-01", "Eth1/1", 500)).thenReturn(List.of(c));
        when(applyLog.statuses(List.of("abc1234"))).thenReturn(Map.of("abc1234", ApplyStatus.FAILED));

        var entries = orchestrator.history("Leaf-01", "Eth1/1", 10_000);

        assertThat(entries).singleElement().satisfies(e -> assertThat(e.applyStatus()).isEqualTo(ApplyStatus.FAILED));
    }

    private void stubCommits() {
        when(audit.commit(anyString(), anyString(), any(), anyString())).thenAnswer(inv -> {
            ConfigurationArtifact artifact = inv.getArgument(2);
            return new AuditRecord("c%06d".formatted(ids.incrementAndGet()), ids.get(),
                    inv.getArgument(0), inv.getArgument(1), artifact, inv.getArgument(3),
                    Fixtures.CLOCK.instant(), null, CommitKind.CHANGE, null);
        });
    }

    private static AuditRecord record(String id, ConfigurationArtifact artifact, CommitKind kind, String source) {
        return new AuditRecord(id, 1, artifact.device(), artifact.iface(), artifact, "alice",
                Fixtures.CLOCK.instant(), null, kind, source);
    }
}
