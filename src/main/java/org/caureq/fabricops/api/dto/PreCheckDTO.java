package org.caureq.fabricops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.fabricops.domain.PortStatus;
import org.caureq.fabricops.domain.PreCheckResult;

import java.util.List;
import java.util.Map;

public record PreCheckDTO(
        String device, @JsonProperty("interface") String iface,
        boolean portExists,
        PortStatus adminStatus, PortStatus operStatus,
        Map<String, String> currentConfig,
        List<String> macAddresses,
        List<String> recommendations,
        @JsonProperty("isSafeToConfigure") boolean isSafeToConfigure
) {
    public static PreCheckDTO of(PreCheckResult r) {
        return new PreCheckDTO(r.device(), r.iface(), r.portExists(), r.adminStatus(), r.operStatus(),
                r.currentConfig(), r.learnedMacAddresses().stream().sorted().toList(),
                r.recommendations(), r.safe());
    }
}
