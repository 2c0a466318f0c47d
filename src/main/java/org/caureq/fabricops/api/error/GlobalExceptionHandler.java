// src/main/java/.../api/error/GlobalExceptionHandler.java
package org.caureq.fabricops.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fabricops.api.dto.PreCheckDTO;
import org.caureq.fabricops.service.error.*;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Every pipeline failure names its stage in {@code details.stage}. */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    private Map<String,Object> details(FabricOpsException ex) {
        Map<String,Object> d = new HashMap<>();
        d.put("stage", ex.stage().wireName());
        if (ex.device() != null) d.put("device", ex.device());
        return d;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        List<String> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req),
                        Map.of("stage", Stage.VALIDATION.wireName(), "fieldErrors", fieldErrors))
        );
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed request: " + ex.getMessage(), cid(req),
                        Map.of("stage", Stage.VALIDATION.wireName()))
        );
    }

    @ExceptionHandler(ConfigValidationException.class)
    public ResponseEntity<ApiError> handleConfigValidation(ConfigValidationException ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(UnsafeToConfigureException.class)
    public ResponseEntity<ApiError> handleUnsafe(UnsafeToConfigureException ex, HttpServletRequest req) {
        var d = details(ex);
        d.put("precheck", PreCheckDTO.of(ex.precheck()));
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.UNSAFE_TO_CONFIGURE, ex.getMessage() + ". Check pre-check results.", cid(req), d));
    }

    @ExceptionHandler({DeviceNotFoundException.class, CommitNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(FabricOpsException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(DeviceUnreachableException.class)
    public ResponseEntity<ApiError> handleUnreachable(DeviceUnreachableException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(ErrorCode.DEVICE_UNREACHABLE, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(DeviceRejectedException.class)
    public ResponseEntity<ApiError> handleRejected(DeviceRejectedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(ErrorCode.DEVICE_REJECTED, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(DeviceTimeoutException.class)
    public ResponseEntity<ApiError> handleTimeout(DeviceTimeoutException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(
                build(ErrorCode.TIMEOUT, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(StoreCorruptionException.class)
    public ResponseEntity<ApiError> handleCorruption(StoreCorruptionException ex, HttpServletRequest req) {
        log.error("audit store failure surfaced to {}: {}", req.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.STORE_CORRUPTION, ex.getMessage(), cid(req), details(ex)));
    }

    @ExceptionHandler(ChangeCancelledException.class)
    public ResponseEntity<ApiError> handleCancelled(ChangeCancelledException ex, HttpServletRequest req) {
        var d = details(ex);
        if (ex.commitId() != null) d.put("commitHash", ex.commitId());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                build(ErrorCode.CANCELLED, ex.getMessage(), cid(req), d));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of("stage", Stage.VALIDATION.wireName()))
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {}", req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
