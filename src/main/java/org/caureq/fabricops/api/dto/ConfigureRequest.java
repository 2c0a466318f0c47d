package org.caureq.fabricops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.*;
import org.caureq.fabricops.domain.ChangeRequest;
import org.caureq.fabricops.domain.PortMode;

import java.util.List;
import java.util.Set;

public record ConfigureRequest(
        @NotBlank @Size(max = 128) String device,
        @JsonProperty("interface") @NotBlank @Size(max = 64) String iface,
        @Min(1) @Max(4094) Integer vlan,
        @Size(max = 4094) List<@NotNull @Min(1) @Max(4094) Integer> allowedVlans,
        @Size(max = 254) String description,
        @Pattern(regexp = "(?i)access|trunk", message = "mode must be access or trunk") String mode,
        @Min(1) @Max(16777215) Integer vni,
        @Pattern(regexp = "^[A-Za-z0-9_.:-]{1,32}$") String vrf
) {
    public ChangeRequest toChange() {
        return ChangeRequest.builder()
                .device(device.trim())
                .iface(iface.trim())
                .vlan(vlan)
                .allowedVlans(allowedVlans == null ? Set.of() : Set.copyOf(allowedVlans))
                .description(description)
                .mode(mode == null ? PortMode.ACCESS : PortMode.from(mode))
                .vni(vni)
                .vrf(vrf)
                .build();
    }
}
