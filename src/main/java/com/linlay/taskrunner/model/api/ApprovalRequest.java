package com.linlay.taskrunner.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ApprovalRequest(
        @NotBlank
        @JsonProperty("plan_id")
        String planId,
        @NotNull
        Boolean approved
) {
}
