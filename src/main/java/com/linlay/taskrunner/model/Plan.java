package com.linlay.taskrunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Plan(
        @JsonProperty("plan_id") String planId,
        String title,
        List<PlanStep> steps
) {

    public Plan {
        Objects.requireNonNull(planId, "planId");
        title = title == null ? "" : title.trim();
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Builds a fresh plan whose step ids run 1..n, all pending.
     */
    public static Plan create(String planId, String title, List<String> stepTitles) {
        return new Plan(planId, title, numberedSteps(0, stepTitles));
    }

    /**
     * Numbers a step generation starting right after {@code keep}: ids are keep+1, keep+2, ...
     */
    public static List<PlanStep> numberedSteps(int keep, List<String> stepTitles) {
        List<PlanStep> steps = new ArrayList<>();
        if (stepTitles == null) {
            return steps;
        }
        int next = keep + 1;
        for (String title : stepTitles) {
            steps.add(PlanStep.pending(next++, title));
        }
        return steps;
    }
}
