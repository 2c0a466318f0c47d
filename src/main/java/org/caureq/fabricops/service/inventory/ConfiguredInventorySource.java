package org.caureq.fabricops.service.inventory;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.config.FabricProps;
import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.service.error.DeviceNotFoundException;
import org.springframework.stereotype.Service;

import java.util.*;

/** Inventory declared under {@code fabric.inventory.devices}. Names are matched case-insensitively. */
@Service
@Slf4j
public class ConfiguredInventorySource implements InventorySource {
    private final Map<String, DeviceDescriptor> byName;

    public ConfiguredInventorySource(FabricProps props) {
        Map<String, DeviceDescriptor> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (var d : props.devices()) {
            if (d.name() == null || d.name().isBlank()) {
                throw new IllegalArgumentException("inventory entry without a name");
            }
            var prev = m.put(d.name().trim(), new DeviceDescriptor(d.name().trim(), d.role(), d.site(), d.host(),
                    d.platform() == null ? "nxos" : d.platform()));
            if (prev != null) throw new IllegalArgumentException("duplicate inventory entry: " + d.name());
        }
        this.byName = Collections.unmodifiableMap(m);
        log.info("[Inventory] {} device(s) loaded", byName.size());
    }

    @Override
    public DeviceDescriptor resolve(String deviceName) {
        if (deviceName == null) throw new DeviceNotFoundException(null);
        var d = byName.get(deviceName.trim());
        if (d == null) throw new DeviceNotFoundException(deviceName);
        return d;
    }

    @Override
    public List<DeviceDescriptor> list() {
        return List.copyOf(byName.values());
    }
}
