package org.caureq.fabricops.service.error;

/** Malformed change request; raised before anything touches a device or the audit store. */
public class ConfigValidationException extends FabricOpsException {
    public ConfigValidationException(String message) {
        super(Stage.VALIDATION, null, message, null);
    }

    public ConfigValidationException(Stage stage, String device, String message) {
        super(stage, device, message, null);
    }
}
