package org.caureq.fabricops.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fabricops.api.dto.BulkConfigureRequest;
import org.caureq.fabricops.api.dto.ConfigureRequest;
import org.caureq.fabricops.api.dto.ConfigureResponse;
import org.caureq.fabricops.api.dto.PreCheckDTO;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.ChangeOutcome;
import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.PortMode;
import org.caureq.fabricops.service.ChangeOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Port change APIs.
 *
 * Every configure goes through the pre-check gate and is committed to the audit history
 * <b>before</b> it is pushed: history records intent, and a commit stays there even when the
 * device refused it. A failed apply answers 502 with the per-device results so the caller can
 * retry or roll back explicitly.
 */
@RestController
@RequestMapping("/api/v1/port")
@RequiredArgsConstructor
public class PortController {
    private final ChangeOrchestrator orchestrator;
    private final FabricProps props;

    /**
     * Read-only safety check. Without mode/vlan the check assumes the port is about to change,
     * so any learned MAC makes it unsafe.
     */
    @PostMapping("/pre-check")
    public PreCheckDTO preCheck(@RequestParam String device,
                                @RequestParam("interface") String iface,
                                @RequestParam(value = "mode", required = false) String mode,
                                @RequestParam(value = "vlan", required = false) Integer vlan) {
        if (mode == null && vlan == null) {
            return PreCheckDTO.of(orchestrator.precheck(device, iface));
        }
        var intent = ChangeRequest.builder()
                .device(device).iface(iface).vlan(vlan)
                .mode(mode == null ? PortMode.ACCESS : PortMode.from(mode))
                .build();
        return PreCheckDTO.of(orchestrator.precheck(intent));
    }

    @PostMapping("/configure")
    public ResponseEntity<ConfigureResponse> configure(@RequestBody @Valid ConfigureRequest body,
                                                       @RequestHeader(value = "X-Operator", required = false) String operator) {
        var outcome = orchestrator.configure(body.toChange(), props.author(operator));
        return respond(outcome, "configured");
    }

    @PostMapping("/configure/bulk")
    public ResponseEntity<ConfigureResponse> configureBulk(@RequestBody @Valid BulkConfigureRequest body,
                                                           @RequestHeader(value = "X-Operator", required = false) String operator) {
        var changes = body.changes().stream().map(ConfigureRequest::toChange).toList();
        var outcome = orchestrator.configureAll(changes, props.author(operator));
        return respond(outcome, "configured");
    }

    static ResponseEntity<ConfigureResponse> respond(ChangeOutcome outcome, String verb) {
        var status = outcome.success() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(ConfigureResponse.of(outcome, verb));
    }
}
