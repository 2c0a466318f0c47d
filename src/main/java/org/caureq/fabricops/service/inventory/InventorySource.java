package org.caureq.fabricops.service.inventory;

import org.caureq.fabricops.domain.DeviceDescriptor;
import org.caureq.fabricops.service.error.DeviceNotFoundException;

import java.util.List;

/** Read-only device registry. */
public interface InventorySource {

    /** @throws DeviceNotFoundException when the name is unknown */
    DeviceDescriptor resolve(String deviceName);

    /** Snapshot of every managed device, sorted by name. */
    List<DeviceDescriptor> list();
}
