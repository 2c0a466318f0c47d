package org.caureq.fabricops.service;

import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.PortMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;

/**
 * NX-OS interface stanza. Order is fixed: selector, description, switchport, mode lines,
 * VXLAN block, VRF membership, {@code no shutdown} last. Trunk VLANs are written as NX-OS ranges.
 */
@Component
public class NxosConfigRenderer implements ConfigRenderer {
    private static final String IN = "  ";
    static final int RANGES_PER_LINE = 32;

    @Override
    public List<String> render(ChangeRequest r) {
        List<String> lines = new ArrayList<>();
        lines.add("interface " + r.iface());
        if (r.description() != null && !r.description().isBlank()) {
            lines.add(IN + "description " + r.description().trim());
        }
        lines.add(IN + "switchport");
        if (r.mode() == PortMode.ACCESS) {
            lines.add(IN + "switchport mode access");
            if (r.vlan() != null) lines.add(IN + "switchport access vlan " + r.vlan());
        } else {
            lines.add(IN + "switchport mode trunk");
            var chunks = chunks(ranges(r.trunkVlans()));
            for (int i = 0; i < chunks.size(); i++) {
                lines.add(IN + (i == 0 ? "switchport trunk allowed vlan " : "switchport trunk allowed vlan add ")
                        + chunks.get(i));
            }
        }
        if (r.vni() != null) {
            lines.add(IN + "vxlan");
            lines.add(IN + IN + "vni " + r.vni());
        }
        if (r.vrf() != null && !r.vrf().isBlank()) {
            lines.add(IN + "vrf member " + r.vrf());
        }
        lines.add(IN + "no shutdown");
        return lines;
    }

    /** {10,11,12,20} -> ["10-12", "20"] */
    static List<String> ranges(SortedSet<Integer> vlans) {
        List<String> out = new ArrayList<>();
        Integer start = null;
        Integer prev = null;
        for (int v : vlans) {
            if (prev != null && v == prev + 1) {
                prev = v;
                continue;
            }
            if (start != null) out.add(range(start, prev));
            start = v;
            prev = v;
        }
        if (start != null) out.add(range(start, prev));
        return out;
    }

    /* at most RANGES_PER_LINE ranges per line, the rest goes to "allowed vlan add" lines */
    private static List<String> chunks(List<String> ranges) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < ranges.size(); i += RANGES_PER_LINE) {
            out.add(String.join(",", ranges.subList(i, Math.min(i + RANGES_PER_LINE, ranges.size()))));
        }
        return out;
    }

    private static String range(int from, int to) {
        return from == to ? Integer.toString(from) : from + "-" + to;
    }
}
