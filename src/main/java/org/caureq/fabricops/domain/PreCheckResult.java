package org.caureq.fabricops.domain;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record PreCheckResult(
        String device,
        String iface,
        boolean portExists,
        PortStatus adminStatus,
        PortStatus operStatus,
        Map<String, String> currentConfig,
        Set<String> learnedMacAddresses,
        List<String> recommendations,
        boolean safe
) {
    public PreCheckResult {
        currentConfig = Map.copyOf(currentConfig);
        learnedMacAddresses = Set.copyOf(learnedMacAddresses);
        recommendations = List.copyOf(recommendations);
    }
}
