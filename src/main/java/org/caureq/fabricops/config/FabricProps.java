package org.caureq.fabricops.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "fabric")
public record FabricProps(String apiKey, String defaultAuthor, String executor,
                          PrecheckProps precheck, FleetProps fleet, AuditProps audit,
                          InventoryProps inventory) {
    /** Timeout of the state read done before each change */
    public record PrecheckProps(Duration timeout) {}
    /** Shared worker pool and per-dispatch limits */
    public record FleetProps(Integer poolSize, Integer concurrencyLimit, Duration perDeviceTimeout) {}
    public record AuditProps(Integer pageSize, Integer maxHistoryLimit) {}
    public record InventoryProps(List<DeviceEntry> devices) {}
    public record DeviceEntry(String name, String role, String site, String host, String platform) {}

    public String author(String requested) {
        if (requested != null && !requested.isBlank()) return requested.trim();
        return (defaultAuthor == null || defaultAuthor.isBlank()) ? "api_user" : defaultAuthor;
    }

    public Duration precheckTimeout() {
        return (precheck == null || precheck.timeout() == null) ? Duration.ofSeconds(10) : precheck.timeout();
    }

    public int poolSize() {
        return (fleet == null || fleet.poolSize() == null) ? 10 : Math.max(1, fleet.poolSize());
    }

    public int concurrencyLimit() {
        return (fleet == null || fleet.concurrencyLimit() == null) ? poolSize() : Math.max(1, fleet.concurrencyLimit());
    }

    public Duration perDeviceTimeout() {
        return (fleet == null || fleet.perDeviceTimeout() == null) ? Duration.ofSeconds(30) : fleet.perDeviceTimeout();
    }

    public int pageSize() {
        return (audit == null || audit.pageSize() == null) ? 100 : Math.max(1, audit.pageSize());
    }

    public int maxHistoryLimit() {
        return (audit == null || audit.maxHistoryLimit() == null) ? 500 : audit.maxHistoryLimit();
    }

    public List<DeviceEntry> devices() {
        return (inventory == null || inventory.devices() == null) ? List.of() : inventory.devices();
    }
}
