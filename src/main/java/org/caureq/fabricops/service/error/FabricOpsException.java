package org.caureq.fabricops.service.error;

/** Base of every failure raised by the change pipeline. */
public abstract class FabricOpsException extends RuntimeException {
    private final Stage stage;
    private final String device;

    protected FabricOpsException(Stage stage, String device, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.device = device;
    }

    public Stage stage() { return stage; }
    public String device() { return device; }
}
