package org.caureq.fabricops.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.PreCheckResult;
import org.caureq.fabricops.service.device.DeviceExecutor;
import org.caureq.fabricops.service.inventory.InventorySource;
import org.springframework.stereotype.Service;

/**
 * Reads a port and decides whether it may be reconfigured.
 * Device failures (unreachable, timeout) propagate to the caller untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreCheckEngine {
    private final InventorySource inventory;
    private final DeviceExecutor devices;
    private final FabricProps props;

    /** Bare pre-check: with no intent, learned MACs make the port unsafe. */
    public PreCheckResult check(String device, String iface) {
        return check(device, iface, null);
    }

    public PreCheckResult check(ChangeRequest request) {
        return check(request.device(), request.iface(), request);
    }

    private PreCheckResult check(String device, String iface, ChangeRequest intent) {
        var descriptor = inventory.resolve(device);
        var state = devices.readState(descriptor, iface, props.precheckTimeout());

        boolean safe = SafetyPolicy.isSafe(state, intent);
        var recommendations = SafetyPolicy.recommendations(state, intent, iface);

        log.info("[PreCheck] {} {} exists={} admin={} oper={} macs={} safe={}",
                descriptor.name(), iface, state.portExists(), state.adminStatus(), state.operStatus(),
                state.learnedMacAddresses().size(), safe);
        return new PreCheckResult(descriptor.name(), iface, state.portExists(),
                state.adminStatus(), state.operStatus(), state.currentConfig(),
                state.learnedMacAddresses(), recommendations, safe);
    }
}
