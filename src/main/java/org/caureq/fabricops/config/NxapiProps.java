package org.caureq.fabricops.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nxapi")
public record NxapiProps(String scheme, Integer port, String username, String password,
                         boolean insecure) {

    public String baseUrl(String host) {
        var s = (scheme == null || scheme.isBlank()) ? "https" : scheme;
        return port == null ? "%s://%s".formatted(s, host) : "%s://%s:%d".formatted(s, host, port);
    }
}
