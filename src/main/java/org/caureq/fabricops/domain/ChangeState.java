package org.caureq.fabricops.domain;

/**
 * Lifecycle of one change: RECEIVED -> PRECHECKED -> (REJECTED | COMMITTED) -> APPLIED -> (SUCCEEDED | FAILED).
 */
public enum ChangeState {
    RECEIVED, PRECHECKED, REJECTED, COMMITTED, APPLIED, SUCCEEDED, FAILED;

    public boolean terminal() {
        return this == REJECTED || this == SUCCEEDED || this == FAILED;
    }
}
