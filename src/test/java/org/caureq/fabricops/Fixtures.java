package org.caureq.fabricops;

import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Shared test data: a small dc1 fabric and a frozen clock. */
public final class Fixtures {
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {}

    public static FabricProps props() {
        return props(Duration.ofSeconds(2));
    }

    public static FabricProps props(Duration perDeviceTimeout) {
        return new FabricProps(null, "api_user", "simulated",
                new FabricProps.PrecheckProps(Duration.ofSeconds(1)),
                new FabricProps.FleetProps(4, 4, perDeviceTimeout),
                new FabricProps.AuditProps(3, 500),
                new FabricProps.InventoryProps(List.of(
                        new FabricProps.DeviceEntry("spine-01", "spine", "dc1", "10.0.0.1", null),
                        new FabricProps.DeviceEntry("leaf-01", "leaf", "dc1", "10.0.1.1", null),
                        new FabricProps.DeviceEntry("leaf-02", "leaf", "dc1", "10.0.1.2", null))));
    }

    public static DeviceDescriptor device(String name) {
        return new DeviceDescriptor(name, "leaf", "dc1", null, "nxos");
    }

    public static ChangeRequest serverLink() {
        return ChangeRequest.builder()
                .device("leaf-01").iface("Eth1/1")
                .mode(PortMode.ACCESS).vlan(10)
                .description("Server Link")
                .build();
    }

    public static DeviceState idlePort() {
        return new DeviceState(true, PortStatus.UP, PortStatus.DOWN,
                Map.of("mode", "access", "vlan", "1", "description", "Uplink to Core"), Set.of());
    }

    public static DeviceState livePort(String... macs) {
        return new DeviceState(true, PortStatus.UP, PortStatus.UP,
                Map.of("mode", "access", "vlan", "1"), Set.of(macs));
    }

    public static ConfigurationArtifact artifact(String device, String iface, int vlan) {
        return new ConfigurationArtifact(device, iface, List.of(
                "interface " + iface,
                "  switchport",
                "  switchport mode access",
                "  switchport access vlan " + vlan,
                "  no shutdown"), CLOCK.instant());
    }
}
