package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.model.PlanStep;

import java.util.List;
import java.util.StringJoiner;

/**
 * Prompt texts used while executing a plan. Prior outcomes are always truncated so prompt size
 * stays bounded as steps accumulate.
 */
public final class PlanPromptBuilder {

    private PlanPromptBuilder() {
    }

    public static String executorPrompt(
            String systemPrompt,
            String planTitle,
            String stepTitle,
            int stepIndex,
            int totalSteps,
            List<StepOutcome> pastSteps,
            int summaryMaxChars
    ) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(systemPrompt == null ? "" : systemPrompt).append("\n\n");
        prompt.append("Plan title: ").append(planTitle).append('\n');
        prompt.append("Current step (").append(stepIndex + 1).append('/').append(totalSteps).append("): ")
                .append(stepTitle).append("\n\n");
        String past = summarize(pastSteps, summaryMaxChars);
        if (!past.isEmpty()) {
            prompt.append("Completed steps:\n").append(past).append("\n\n");
        }
        prompt.append("Focus on completing the current step only. Briefly summarize the result when done.");
        return prompt.toString();
    }

    public static String stepMessage(int stepIndex, String stepTitle) {
        return "Execute step " + (stepIndex + 1) + ": " + stepTitle;
    }

    public static String replanPrompt(
            String planTitle,
            List<StepOutcome> pastSteps,
            List<PlanStep> remainingSteps,
            int summaryMaxChars
    ) {
        StringJoiner remaining = new StringJoiner("\n");
        for (PlanStep step : remainingSteps) {
            remaining.add("Step " + step.id() + ": " + step.title());
        }
        return """
                You are a plan evaluator. Decide whether the plan needs to change given the progress so far.

                Plan title: %s

                Completed steps:
                %s

                Remaining steps:
                %s

                Choose one action:
                - continue: the remaining steps are still right, go on with the next one
                - revise: the results so far call for different remaining steps
                - finish: the goal is already reached, skip the remaining steps

                Reply in JSON.""".formatted(planTitle, summarize(pastSteps, summaryMaxChars), remaining);
    }

    static String summarize(List<StepOutcome> pastSteps, int maxChars) {
        StringJoiner joiner = new StringJoiner("\n");
        for (int i = 0; i < pastSteps.size(); i++) {
            StepOutcome outcome = pastSteps.get(i);
            joiner.add("Step " + (i + 1) + " [" + outcome.title() + "]: " + truncate(outcome.result(), maxChars));
        }
        return joiner.toString();
    }

    static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return maxChars > 0 && value.length() > maxChars ? value.substring(0, maxChars) : value;
    }
}
