package org.caureq.fabricops.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fabricops.api.dto.CommitDetailDTO;
import org.caureq.fabricops.api.dto.ConfigureResponse;
import org.caureq.fabricops.api.dto.HistoryItemDTO;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.service.ChangeOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Audit history and rollback. */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HistoryController {
    private final ChangeOrchestrator orchestrator;
    private final FabricProps props;

    /**
     * Most recent first.
     *
     * @param device optional exact device name
     * @param iface optional interface, only with a device
     * @param limit 1..fabric.audit.max-history-limit (default 50)
     */
    @GetMapping("/history")
    public Map<String, List<HistoryItemDTO>> history(
            @RequestParam(value = "device", required = false) String device,
            @RequestParam(value = "interface", required = false) String iface,
            @RequestParam(value = "limit", required = false, defaultValue = "50") int limit) {
        if (limit < 1 || limit > props.maxHistoryLimit()) {
            throw new IllegalArgumentException("limit must be between 1 and " + props.maxHistoryLimit());
        }
        var items = orchestrator.history(device, iface, limit).stream().map(HistoryItemDTO::of).toList();
        return Map.of("history", items);
    }

    @GetMapping("/history/{commitId}")
    public CommitDetailDTO show(@PathVariable String commitId) {
        var entry = orchestrator.show(commitId);
        return CommitDetailDTO.of(entry, orchestrator.attempts(entry.record().commitId()));
    }

    /** Re-commits the old content as a new commit (history is never rewritten) and pushes it. */
    @PostMapping("/rollback/{commitId}")
    public ResponseEntity<ConfigureResponse> rollback(@PathVariable String commitId,
                                                      @RequestHeader(value = "X-Operator", required = false) String operator) {
        var outcome = orchestrator.rollback(commitId, props.author(operator));
        return PortController.respond(outcome, "rolled back");
    }
}
