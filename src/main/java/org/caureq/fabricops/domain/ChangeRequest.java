package org.caureq.fabricops.domain;

import lombok.Builder;
import org.caureq.fabricops.service.error.ConfigValidationException;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Desired state of one switch port. Immutable, validated on construction.
 * <p>
 * In trunk mode {@code vlan} and {@code allowedVlans} together form the allowed VLAN set;
 * in access mode {@code vlan} is the single untagged VLAN and {@code allowedVlans} must be empty.
 */
@Builder(toBuilder = true)
public record ChangeRequest(String device,
                            String iface,
                            Integer vlan,
                            Set<Integer> allowedVlans,
                            String description,
                            PortMode mode,
                            Integer vni,
                            String vrf) {

    public static final int MAX_VLAN = 4094;
    public static final int MAX_VNI = 16_777_215;
    private static final Pattern VRF_NAME = Pattern.compile("^[A-Za-z0-9_.:-]{1,32}$");

    public ChangeRequest {
        mode = mode == null ? PortMode.ACCESS : mode;
        allowedVlans = allowedVlans == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(allowedVlans));

        if (device == null || device.isBlank()) throw new ConfigValidationException("device is required");
        if (iface == null || iface.isBlank()) throw new ConfigValidationException("interface is required");
        singleLine("device", device);
        singleLine("interface", iface);
        singleLine("description", description);
        if (description != null && description.length() > 254) {
            throw new ConfigValidationException("description longer than 254 characters");
        }
        if (vlan != null) checkVlan(vlan);
        allowedVlans.forEach(ChangeRequest::checkVlan);
        if (mode == PortMode.ACCESS && !allowedVlans.isEmpty()) {
            throw new ConfigValidationException("access mode carries a single vlan, allowedVlans is trunk only");
        }
        if (vni != null && (vni < 1 || vni > MAX_VNI)) {
            throw new ConfigValidationException("vni must be within 1-" + MAX_VNI + ": " + vni);
        }
        if (vrf != null && !VRF_NAME.matcher(vrf).matches()) {
            throw new ConfigValidationException("invalid vrf name: " + vrf);
        }
    }

    /** Effective trunk allowed set ({@code vlan} plus {@code allowedVlans}), sorted. */
    public SortedSet<Integer> trunkVlans() {
        var all = new TreeSet<>(allowedVlans);
        if (vlan != null) all.add(vlan);
        return Collections.unmodifiableSortedSet(all);
    }

    private static void checkVlan(Integer v) {
        if (v == null || v < 1 || v > MAX_VLAN) {
            throw new ConfigValidationException("vlan must be within 1-" + MAX_VLAN + ": " + v);
        }
    }

    private static void singleLine(String field, String value) {
        if (value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0)) {
            throw new ConfigValidationException(field + " must not contain line breaks");
        }
    }
}
