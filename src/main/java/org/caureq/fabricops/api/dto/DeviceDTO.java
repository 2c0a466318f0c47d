package org.caureq.fabricops.api.dto;

import org.caureq.fabricops.domain.DeviceDescriptor;

public record DeviceDTO(String name, String role, String site, String platform) {
    public static DeviceDTO of(DeviceDescriptor d) {
        return new DeviceDTO(d.name(), d.role(), d.site(), d.platform());
    }
}
