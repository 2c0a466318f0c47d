package org.caureq.fabricops.service.error;

public class DeviceUnreachableException extends FabricOpsException {
    public DeviceUnreachableException(Stage stage, String device, String message, Throwable cause) {
        super(stage, device, message, cause);
    }
}
