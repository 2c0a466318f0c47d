package org.caureq.fabricops.domain;

/** Connection descriptor for one managed device, as returned by the inventory. */
public record DeviceDescriptor(String name, String role, String site, String host, String platform) {

    /** Address used by transports; falls back to the device name when no host is configured. */
    public String address() {
        return (host == null || host.isBlank()) ? name : host;
    }
}
