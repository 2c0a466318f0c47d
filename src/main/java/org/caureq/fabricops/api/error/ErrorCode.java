
package org.caureq.fabricops.api.error;
public enum ErrorCode {
    BAD_REQUEST, UNSAFE_TO_CONFIGURE, NOT_FOUND, DEVICE_UNREACHABLE, DEVICE_REJECTED,
    TIMEOUT, STORE_CORRUPTION, CANCELLED, AUTH_REQUIRED, INTERNAL_ERROR
}
