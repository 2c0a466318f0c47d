package org.caureq.fabricops.service;

import lombok.RequiredArgsConstructor;
import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.ConfigurationArtifact;
import org.caureq.fabricops.domain.PortMode;
import org.caureq.fabricops.service.error.ConfigValidationException;
import org.caureq.fabricops.service.error.Stage;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Intent to configuration text. No I/O: identical requests give identical lines,
 * which keeps commit digests and idempotence checks meaningful.
 */
@Service
@RequiredArgsConstructor
public class ConfigSynthesizer {
    private final ConfigRenderer renderer;
    private final Clock clock;

    /**
     * @throws ConfigValidationException when the intent cannot be expressed (e.g. a VNI with no VLAN to map)
     *         or the rendered text would not fit in the audit store
     */
    public ConfigurationArtifact render(ChangeRequest request) {
        if (request.vni() != null) {
            boolean hasVlan = request.mode() == PortMode.ACCESS
                    ? request.vlan() != null
                    : !request.trunkVlans().isEmpty();
            if (!hasVlan) {
                throw new ConfigValidationException(Stage.SYNTHESIS, request.device(),
                        "vni " + request.vni() + " needs a vlan to map on " + request.iface());
            }
        }
        var artifact = new ConfigurationArtifact(request.device(), request.iface(), renderer.render(request), clock.instant());
        if (artifact.text().length() > AuditStore.MAX_CONFIG_CHARS) {
            throw new ConfigValidationException(Stage.SYNTHESIS, request.device(),
                    "rendered configuration for " + request.iface() + " exceeds " + AuditStore.MAX_CONFIG_CHARS + " characters");
        }
        return artifact;
    }
}
