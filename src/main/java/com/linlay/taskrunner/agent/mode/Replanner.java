package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.llm.ReasoningEngine;
import com.linlay.taskrunner.model.PlanStep;
import com.linlay.taskrunner.model.ReplanDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides after each step whether the rest of the plan still holds. Routine progress never
 * reaches the model, and any failure to get a decision means the plan simply continues.
 */
public class Replanner {

    private static final Logger log = LoggerFactory.getLogger(Replanner.class);

    private final ReasoningEngine engine;
    private final AgentRunProperties properties;

    public Replanner(ReasoningEngine engine, AgentRunProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * @param steps     current step list of the plan
     * @param pastSteps outcomes of the steps executed so far, in order
     * @param nextIndex index of the next step to execute
     */
    public ReplanDecision evaluate(String planId, String planTitle, List<PlanStep> steps, List<StepOutcome> pastSteps, int nextIndex) {
        if (!properties.isPlanRevisionEnabled()) {
            return ReplanDecision.proceed("plan revision disabled");
        }
        if (nextIndex >= steps.size()) {
            return ReplanDecision.proceed("no remaining steps");
        }
        if (shouldSkip(pastSteps, nextIndex, steps.size())) {
            return ReplanDecision.proceed("routine progress");
        }

        List<PlanStep> remaining = steps.subList(nextIndex, steps.size());
        String prompt = PlanPromptBuilder.replanPrompt(planTitle, pastSteps, remaining, properties.getReplanSummaryMaxChars());
        try {
            ReplanDecision decision = engine.decide(prompt, ReplanDecision.class);
            if (decision == null) {
                log.warn("[plan:{}] replanner returned no decision, continuing", planId);
                return ReplanDecision.proceed("empty decision");
            }
            log.info("[plan:{}] replanner decision after step {}: {} - {}",
                    planId, nextIndex, decision.action(), decision.reason());
            return decision;
        } catch (Exception ex) {
            log.warn("[plan:{}] replanner failed after step {}, continuing: {}", planId, nextIndex, ex.getMessage());
            return ReplanDecision.proceed("replanner unavailable");
        }
    }

    /**
     * One step left, or the last step went fine: no model call needed.
     */
    static boolean shouldSkip(List<StepOutcome> pastSteps, int nextIndex, int total) {
        if (total - nextIndex <= 1) {
            return true;
        }
        if (!pastSteps.isEmpty()) {
            return !pastSteps.get(pastSteps.size() - 1).isFailure();
        }
        return false;
    }
}
