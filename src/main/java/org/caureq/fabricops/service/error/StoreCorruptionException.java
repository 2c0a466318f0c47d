package org.caureq.fabricops.service.error;

/** The audit store cannot be trusted anymore. Never swallowed. */
public class StoreCorruptionException extends FabricOpsException {
    public StoreCorruptionException(Stage stage, String message, Throwable cause) {
        super(stage, null, message, cause);
    }
}
