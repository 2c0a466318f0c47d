package org.caureq.fabricops;

import org.caureq.fabricops.domain.ApplyStatus;
import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.CommitKind;
import org.caureq.fabricops.service.AuditStore;
import org.caureq.fabricops.service.ChangeOrchestrator;
import org.caureq.fabricops.service.device.SimulatedDeviceExecutor;
import org.caureq.fabricops.service.error.UnsafeToConfigureException;
import org.caureq.fabricops.service.inventory.InventorySource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:fabricops;DB_CLOSE_DELAY=-1",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "fabric.simulated.latency=0ms"
})
class FabricOpsApplicationTest {
    @Autowired ChangeOrchestrator orchestrator;
    @Autowired SimulatedDeviceExecutor sim;
    @Autowired InventorySource inventory;
    @Autowired AuditStore audit;

    @Test
    void changeGateAndRollbackOnTheSimulatedFabric() {
        var vlan10 = ChangeRequest.builder().device("leaf-03").iface("Eth1/10").vlan(10).description("Server Link").build();

        var first = orchestrator.configure(vlan10, "alice");
        var second = orchestrator.configure(vlan10.toBuilder().vlan(20).build(), "alice");
        assertThat(first.success()).isTrue();
        assertThat(second.success()).isTrue();
        assertThat(second.primaryCommit().parentCommitId()).isEqualTo(first.primaryCommit().commitId());

        sim.learnMac("leaf-03", "Eth1/10", "aa:bb:cc:dd:ee:ff");
        assertThatThrownBy(() -> orchestrator.configure(vlan10.toBuilder().vlan(30).build(), "alice"))
                .isInstanceOf(UnsafeToConfigureException.class);

        var back = orchestrator.rollback(first.primaryCommit().commitId(), "bob");
        assertThat(back.success()).isTrue();

        var port = sim.readState(inventory.resolve("leaf-03"), "Eth1/10", Duration.ofSeconds(1));
        assertThat(port.currentConfig()).containsEntry("vlan", "10");

        var history = orchestrator.history("leaf-03", "Eth1/10", 10);
        assertThat(history).hasSize(3);
        assertThat(history.get(0).record().kind()).isEqualTo(CommitKind.ROLLBACK);
        assertThat(history.get(0).record().artifact().text()).isEqualTo(first.primaryCommit().artifact().text());
        assertThat(history).allMatch(e -> e.applyStatus() == ApplyStatus.SUCCEEDED);
        assertThat(audit.healthy()).isTrue();
    }
}
