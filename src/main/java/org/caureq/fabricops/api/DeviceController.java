package org.caureq.fabricops.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fabricops.api.dto.DeviceDTO;
import org.caureq.fabricops.service.ChangeOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class DeviceController {
    private final ChangeOrchestrator orchestrator;

    @GetMapping("/api/v1/devices")
    public Map<String, List<DeviceDTO>> devices() {
        return Map.of("devices", orchestrator.devices().stream().map(DeviceDTO::of).toList());
    }

    @GetMapping("/")
    public Map<String, Object> index() {
        return Map.of(
                "message", "Fabric port automation API",
                "version", "1.0.0",
                "auditStore", orchestrator.storeHealthy() ? "ok" : "corrupted",
                "endpoints", Map.of(
                        "pre_check", "/api/v1/port/pre-check",
                        "configure", "/api/v1/port/configure",
                        "configure_bulk", "/api/v1/port/configure/bulk",
                        "history", "/api/v1/history",
                        "rollback", "/api/v1/rollback/{commitId}",
                        "devices", "/api/v1/devices"
                )
        );
    }
}
