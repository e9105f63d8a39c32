package com.linlay.taskrunner.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApprovalResponse(
        boolean accepted,
        String status,
        @JsonProperty("plan_id")
        String planId,
        String detail
) {
}
