package com.phoenix.worker.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record WorkflowStartRequest(
    @NotBlank String kind,
    @NotBlank @Size(max = 300) String subject
) {
}
