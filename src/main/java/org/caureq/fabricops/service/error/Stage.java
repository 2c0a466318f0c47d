package org.caureq.fabricops.service.error;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Pipeline stage a failure is attributed to. */
public enum Stage {
    VALIDATION, INVENTORY, PRECHECK, SYNTHESIS, COMMIT, APPLY, ROLLBACK, HISTORY;

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
