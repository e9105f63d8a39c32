package com.linlay.taskrunner.model;

import java.util.Objects;

public record PlanStep(
        int id,
        String title,
        StepStatus status
) {

    public PlanStep {
        if (id < 1) {
            throw new IllegalArgumentException("step id must start at 1");
        }
        title = title == null ? "" : title.trim();
        Objects.requireNonNull(status, "status");
    }

    public static PlanStep pending(int id, String title) {
        return new PlanStep(id, title, StepStatus.PENDING);
    }

    public PlanStep withStatus(StepStatus next) {
        return new PlanStep(id, title, next);
    }
}
