package org.caureq.fabricops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.fabricops.domain.ApplyErrorKind;
import org.caureq.fabricops.domain.ApplyLog;

import java.time.Instant;

public record ApplyAttemptDTO(String device, @JsonProperty("interface") String iface, boolean success,
                              ApplyErrorKind error, String detail, long durationMs, String author, Instant timestamp) {
    public static ApplyAttemptDTO of(ApplyLog l) {
        return new ApplyAttemptDTO(l.getDevice(), l.getIface(), l.isSuccess(), l.getErrorKind(), l.getErrorDetail(),
                l.getDurationMs(), l.getAuthor(), l.getTs());
    }
}
