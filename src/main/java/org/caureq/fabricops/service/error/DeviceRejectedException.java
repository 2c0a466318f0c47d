package org.caureq.fabricops.service.error;

/** The device answered but refused the commands (CLI error, bad syntax, locked config...). */
public class DeviceRejectedException extends FabricOpsException {
    private final String reason;

    public DeviceRejectedException(String device, String reason) {
        super(Stage.APPLY, device, "device %s rejected configuration: %s".formatted(device, reason), null);
        this.reason = reason;
    }

    public String reason() { return reason; }
}
