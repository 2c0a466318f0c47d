package org.caureq.fabricops.domain;

import java.time.Instant;
import java.util.List;

/** Rendered, device-native configuration for one interface. Lines keep their indentation. */
public record ConfigurationArtifact(String device, String iface, List<String> lines, Instant synthesizedAt) {

    public ConfigurationArtifact {
        lines = List.copyOf(lines);
    }

    public String text() {
        return String.join("\n", lines);
    }

    public static ConfigurationArtifact fromText(String device, String iface, String text, Instant synthesizedAt) {
        return new ConfigurationArtifact(device, iface, List.of(text.split("\n", -1)), synthesizedAt);
    }
}
