package org.caureq.fabricops.domain;

import java.time.Duration;

/** Outcome of one fan-out unit. Index by device, never by position. */
public record ApplyResult(String device,
                          String iface,
                          String commitId,
                          boolean success,
                          ApplyErrorKind errorKind,
                          String errorDetail,
                          Duration duration) {

    public static ApplyResult ok(FleetTarget t, Duration took) {
        return new ApplyResult(t.device().name(), t.artifact().iface(), t.commitId(), true, null, null, took);
    }

    public static ApplyResult failed(FleetTarget t, ApplyErrorKind kind, String detail, Duration took) {
        return new ApplyResult(t.device().name(), t.artifact().iface(), t.commitId(), false, kind, detail, took);
    }
}
