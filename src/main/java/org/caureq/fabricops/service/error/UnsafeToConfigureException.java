package org.caureq.fabricops.service.error;

import org.caureq.fabricops.domain.PreCheckResult;

public class UnsafeToConfigureException extends FabricOpsException {
    private final PreCheckResult precheck;

    public UnsafeToConfigureException(PreCheckResult precheck) {
        super(Stage.PRECHECK, precheck.device(),
                "Port %s on %s is not safe to configure".formatted(precheck.iface(), precheck.device()), null);
        this.precheck = precheck;
    }

    public PreCheckResult precheck() { return precheck; }
}
