package org.caureq.fabricops.domain;

import java.util.Map;
import java.util.Set;

/** Raw port state as read from a device (show interface / switchport / mac address-table). */
public record DeviceState(boolean portExists,
                          PortStatus adminStatus,
                          PortStatus operStatus,
                          Map<String, String> currentConfig,
                          Set<String> learnedMacAddresses) {

    public DeviceState {
        adminStatus = adminStatus == null ? PortStatus.UNKNOWN : adminStatus;
        operStatus = operStatus == null ? PortStatus.UNKNOWN : operStatus;
        currentConfig = currentConfig == null ? Map.of() : Map.copyOf(currentConfig);
        learnedMacAddresses = learnedMacAddresses == null ? Set.of() : Set.copyOf(learnedMacAddresses);
    }

    public static DeviceState missing() {
        return new DeviceState(false, PortStatus.UNKNOWN, PortStatus.UNKNOWN, Map.of(), Set.of());
    }
}
