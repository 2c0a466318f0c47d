package org.caureq.fabricops.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PortMode {
    ACCESS, TRUNK;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static PortMode from(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "access" -> ACCESS;
            case "trunk" -> TRUNK;
            default -> throw new IllegalArgumentException("unknown port mode: " + raw);
        };
    }
}
