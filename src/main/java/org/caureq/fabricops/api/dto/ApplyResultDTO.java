package org.caureq.fabricops.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.caureq.fabricops.domain.ApplyErrorKind;
import org.caureq.fabricops.domain.ApplyResult;

public record ApplyResultDTO(String device, @JsonProperty("interface") String iface, String commitId,
                             boolean success, ApplyErrorKind error, String detail, long durationMs) {
    public static ApplyResultDTO of(ApplyResult r) {
        return new ApplyResultDTO(r.device(), r.iface(), r.commitId(), r.success(), r.errorKind(), r.errorDetail(),
                r.duration() == null ? 0 : r.duration().toMillis());
    }
}
