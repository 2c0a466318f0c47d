package org.caureq.fabricops.service;

import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.DeviceState;
import org.caureq.fabricops.domain.PortMode;
import org.caureq.fabricops.domain.PortStatus;

import java.util.*;

/**
 * Pre-check rules. The verdict is a pure function of the port state and the intent;
 * recommendations only describe it.
 */
public final class SafetyPolicy {

    private SafetyPolicy() {}

    /**
     * Unsafe when the port does not exist, or when MACs are learned and the intent changes mode or VLAN.
     * A null intent (bare pre-check) is treated as a mode/VLAN change.
     */
    public static boolean isSafe(DeviceState state, ChangeRequest intent) {
        if (!state.portExists()) return false;
        return state.learnedMacAddresses().isEmpty() || !changesModeOrVlan(state, intent);
    }

    public static boolean changesModeOrVlan(DeviceState state, ChangeRequest intent) {
        if (intent == null) return true;
        var cfg = state.currentConfig();
        var currentMode = cfg.get("mode");
        if (currentMode == null || !currentMode.equalsIgnoreCase(intent.mode().wireName())) return true;
        if (intent.mode() == PortMode.ACCESS) {
            return intent.vlan() != null && !String.valueOf(intent.vlan()).equals(cfg.get("vlan"));
        }
        SortedSet<Integer> wanted = intent.trunkVlans().isEmpty() ? expand("1-4094") : intent.trunkVlans();
        var current = cfg.get("trunk_vlans");
        return !wanted.equals(expand(current == null ? "1-4094" : current));
    }

    public static List<String> recommendations(DeviceState state, ChangeRequest intent, String iface) {
        List<String> out = new ArrayList<>();
        if (!state.portExists()) {
            out.add("Interface " + iface + " does not exist on this device - check the interface name");
            return out;
        }
        if (state.adminStatus() == PortStatus.UP && state.operStatus() == PortStatus.DOWN) {
            out.add("Port is administratively up but operationally down");
        } else if (state.adminStatus() == PortStatus.DOWN) {
            out.add("Port is administratively down - the change ends with 'no shutdown' and will enable it");
        } else if (state.operStatus() == PortStatus.UP) {
            out.add("Port is operationally up");
        }
        int macs = state.learnedMacAddresses().size();
        if (macs == 0) {
            out.add("No MAC addresses learned - safe to reconfigure");
        } else if (changesModeOrVlan(state, intent)) {
            out.add(macs + " MAC address(es) learned - changing mode or VLAN would disrupt live traffic");
        } else {
            out.add(macs + " MAC address(es) learned, requested mode and VLAN match the running configuration");
        }
        var currentDesc = state.currentConfig().get("description");
        if (intent != null && intent.description() != null && currentDesc != null
                && !currentDesc.equals(intent.description().trim())) {
            out.add("Description will change from '" + currentDesc + "' to '" + intent.description().trim() + "'");
        }
        if (state.operStatus() == PortStatus.DOWN && state.adminStatus() == PortStatus.UP) {
            out.add("Consider checking physical connectivity");
        }
        return out;
    }

    /** "1-5,10,20-21" -> {1,2,3,4,5,10,20,21}; unparsable tokens are skipped, values outside 1-4094 dropped. */
    static SortedSet<Integer> expand(String ranges) {
        SortedSet<Integer> out = new TreeSet<>();
        if (ranges == null) return out;
        for (var tok : ranges.split(",")) {
            var t = tok.trim();
            if (t.isEmpty()) continue;
            try {
                int dash = t.indexOf('-');
                if (dash < 0) {
                    int v = Integer.parseInt(t);
                    if (v >= 1 && v <= ChangeRequest.MAX_VLAN) out.add(v);
                } else {
                    int from = Math.max(1, Integer.parseInt(t.substring(0, dash).trim()));
                    int to = Math.min(ChangeRequest.MAX_VLAN, Integer.parseInt(t.substring(dash + 1).trim()));
                    for (int v = from; v <= to; v++) out.add(v);
                }
            } catch (NumberFormatException ignored) {
                // "none" and friends
            }
        }
        return out;
    }
}
