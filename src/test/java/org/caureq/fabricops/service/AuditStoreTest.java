package org.caureq.fabricops.service;

import org.caureq.fabricops.Fixtures;
import org.caureq.fabricops.domain.AuditRecord;
import org.caureq.fabricops.domain.CommitKind;
import org.caureq.fabricops.repo.AuditCommitRepo;
import org.caureq.fabricops.service.error.CommitNotFoundException;
import org.caureq.fabricops.service.error.StoreCorruptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class AuditStoreTest {
    @Autowired AuditCommitRepo repo;

    private AuditStore store;

    @BeforeEach
    void setUp() {
        // page size 3 so that history reads span several pages
        store = new AuditStore(repo, Fixtures.CLOCK, Fixtures.props());
    }

    @Test
    void commitsChainToThePreviousHeadOfTheSameInterface() {
        var c1 = store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", 10), "alice");
        var c2 = store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", 20), "bob");
        var other = store.commit("leaf-01", "Eth1/2", Fixtures.artifact("leaf-01", "Eth1/2", 10), "alice");

        assertThat(c1.parentCommitId()).isNull();
        assertThat(c2.parentCommitId()).isEqualTo(c1.commitId());
        assertThat(other.parentCommitId()).isNull();
        assertThat(c2.sequence()).isGreaterThan(c1.sequence());
        assertThat(c1.commitId()).hasSize(AuditStore.SHORT_ID).matches("[0-9a-f]+");
        assertThat(store.current("leaf-01", "Eth1/1")).map(AuditRecord::commitId).contains(c2.commitId());
    }

    @Test
    void identicalContentAtTheSameInstantGetsDistinctIds() {
        var artifact = Fixtures.artifact("leaf-01", "Eth1/1", 10);

        var a = store.commit("leaf-01", "Eth1/1", artifact, "alice");
        var b = store.commit("leaf-01", "Eth1/1", artifact, "alice");

        assertThat(a.commitId()).isNotEqualTo(b.commitId());
        assertThat(a.committedAt()).isEqualTo(b.committedAt());
    }

    @Test
    void historyIsMostRecentFirstAcrossPages() {
        List<String> ids = new ArrayList<>();
        for (int vlan = 1; vlan <= 7; vlan++) {
            ids.add(store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", vlan), "alice").commitId());
        }
        store.commit("leaf-02", "Eth1/1", Fixtures.artifact("leaf-02", "Eth1/1", 99), "alice");
        Collections.reverse(ids);

        assertThat(store.history("leaf-01", "Eth1/1", 50)).extracting(AuditRecord::commitId).isEqualTo(ids);
        assertThat(store.history("leaf-01", null, 4)).extracting(AuditRecord::commitId).isEqualTo(ids.subList(0, 4));
        assertThat(store.history(null, null, 50)).hasSize(8).first()
                .extracting(AuditRecord::device).isEqualTo("leaf-02");
        assertThatThrownBy(() -> store.history(null, null, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void streamReadsOnlyWhatIsConsumed() {
        for (int vlan = 1; vlan <= 5; vlan++) {
            store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", vlan), "alice");
        }

        try (var s = store.stream("leaf-01", "Eth1/1")) {
            var first = s.findFirst();
            assertThat(first).isPresent();
            assertThat(first.get().artifact().lines()).contains("  switchport access vlan 5");
        }
    }

    @Test
    void rollbackRecommitsTheOldContentAsANewHead() {
        var a = store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", 10), "alice");
        var b = store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", 20), "alice");

        var r = store.rollback(a.commitId(), "bob");

        assertThat(r.kind()).isEqualTo(CommitKind.ROLLBACK);
        assertThat(r.sourceCommitId()).isEqualTo(a.commitId());
        assertThat(r.parentCommitId()).isEqualTo(b.commitId());
        assertThat(r.author()).isEqualTo("bob");
        assertThat(r.artifact().text()).isEqualTo(a.artifact().text());
        assertThat(r.message()).isEqualTo("Rollback leaf-01 Eth1/1 to " + a.commitId());
        assertThat(store.current("leaf-01", "Eth1/1").orElseThrow().artifact().text()).isEqualTo(a.artifact().text());
        assertThat(store.find(b.commitId()).orElseThrow().artifact().text()).isEqualTo(b.artifact().text());
    }

    @Test
    void rollbackToUnknownCommitIsNotFound() {
        assertThatThrownBy(() -> store.rollback("deadbee", "bob")).isInstanceOf(CommitNotFoundException.class);
        assertThat(store.find("deadbee")).isEmpty();
    }

    @Test
    void tamperedRecordDisablesTheStore() {
        var c = store.commit("leaf-01", "Eth1/1", Fixtures.artifact("leaf-01", "Eth1/1", 10), "alice");
        var row = repo.findByCommitId(c.commitId()).orElseThrow();
        row.setConfigText("interface Eth1/1\n  shutdown");
        repo.saveAndFlush(row);

        assertThatThrownBy(() -> store.find(c.commitId())).isInstanceOf(StoreCorruptionException.class);
        assertThat(store.healthy()).isFalse();
        assertThatThrownBy(() -> store.commit("leaf-01", "Eth1/2", Fixtures.artifact("leaf-01", "Eth1/2", 10), "alice"))
                .isInstanceOf(StoreCorruptionException.class);
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void concurrentCommitsKeepIdsUniqueAndChainsLinear() throws Exception {
        var pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<AuditRecord>> futures = new ArrayList<>();
            for (int i = 0; i < 80; i++) {
                var iface = "Eth1/" + (1 + i % 4);
                futures.add(pool.submit(() -> store.commit("leaf-01", iface, Fixtures.artifact("leaf-01", iface, 10), "alice")));
            }
            Set<String> ids = new HashSet<>();
            for (var f : futures) ids.add(f.get(30, TimeUnit.SECONDS).commitId());
            assertThat(ids).hasSize(80);

            for (int port = 1; port <= 4; port++) {
                var chain = store.history("leaf-01", "Eth1/" + port, 100);
                assertThat(chain).hasSize(20);
                for (int i = 0; i < chain.size() - 1; i++) {
                    assertThat(chain.get(i).parentCommitId()).isEqualTo(chain.get(i + 1).commitId());
                    assertThat(chain.get(i).sequence()).isGreaterThan(chain.get(i + 1).sequence());
                }
                assertThat(chain.get(chain.size() - 1).parentCommitId()).isNull();
            }
        } finally {
            pool.shutdownNow();
            repo.deleteAll();
        }
    }
}
