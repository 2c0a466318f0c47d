package org.caureq.fabricops.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkConfigureRequest(@NotEmpty @Size(max = 200) List<@Valid ConfigureRequest> changes) {}
