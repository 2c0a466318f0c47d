package org.caureq.fabricops.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PortStatus {
    UP, DOWN, UNKNOWN;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    /** NX-OS reports things like "up", "down", "sfp-missing", "link-not-connected"... */
    public static PortStatus parse(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        var s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.equals("up") || s.equals("connected")) return UP;
        if (s.equals("down") || s.startsWith("down") || s.contains("not-connected")
                || s.contains("missing") || s.contains("disabled")) return DOWN;
        return UNKNOWN;
    }
}
