package org.caureq.fabricops.service.error;

public class DeviceNotFoundException extends FabricOpsException {
    public DeviceNotFoundException(String device) {
        super(Stage.INVENTORY, device, "device not found in inventory: " + device, null);
    }
}
