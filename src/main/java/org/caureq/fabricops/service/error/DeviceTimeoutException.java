package org.caureq.fabricops.service.error;

import java.time.Duration;

public class DeviceTimeoutException extends FabricOpsException {
    public DeviceTimeoutException(Stage stage, String device, Duration timeout, Throwable cause) {
        super(stage, device, "no answer from %s within %d ms".formatted(device, timeout.toMillis()), cause);
    }
}
