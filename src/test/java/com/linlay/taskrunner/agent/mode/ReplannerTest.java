package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.llm.ScriptedReasoningEngine;
import com.linlay.taskrunner.model.Plan;
import com.linlay.taskrunner.model.PlanStep;
import com.linlay.taskrunner.model.ReplanAction;
import com.linlay.taskrunner.model.ReplanDecision;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReplannerTest {

    private static final List<PlanStep> STEPS = Plan.numberedSteps(0,
            List.of("Search flights", "Book hotel", "Rent car", "Send itinerary"));

    private final AgentRunProperties properties = new AgentRunProperties();
    private final ScriptedReasoningEngine engine = new ScriptedReasoningEngine();
    private final Replanner replanner = new Replanner(engine, properties);

    @Test
    void successfulStepShouldNotConsultModel() {
        ReplanDecision decision = replanner.evaluate("p1", "Trip", STEPS,
                List.of(new StepOutcome("Search flights", "Found 3 flights")), 1);

        assertThat(decision.action()).isEqualTo(ReplanAction.CONTINUE);
        assertThat(engine.decideCalls()).isZero();
    }

    @Test
    void singleRemainingStepShouldNotConsultModel() {
        ReplanDecision decision = replanner.evaluate("p1", "Trip", STEPS,
                List.of(
                        new StepOutcome("Search flights", "ok"),
                        new StepOutcome("Book hotel", "ok"),
                        StepOutcome.failed("Rent car", "no cars left")
                ), 3);

        assertThat(decision.action()).isEqualTo(ReplanAction.CONTINUE);
        assertThat(engine.decideCalls()).isZero();
    }

    @Test
    void failedStepWithSeveralRemainingShouldConsultModel() {
        ReplanDecision revise = new ReplanDecision(ReplanAction.REVISE, null,
                List.of("Try another airline", "Send itinerary"), "no flights");
        engine.decision(revise);

        ReplanDecision decision = replanner.evaluate("p1", "Trip", STEPS,
                List.of(StepOutcome.failed("Search flights", "timeout")), 1);

        assertThat(engine.decideCalls()).isEqualTo(1);
        assertThat(decision).isEqualTo(revise);
    }

    @Test
    void modelFailureShouldDegradeToContinue() {
        engine.decision(new IllegalStateException("model down"));

        ReplanDecision decision = replanner.evaluate("p1", "Trip", STEPS,
                List.of(StepOutcome.failed("Search flights", "timeout")), 1);

        assertThat(engine.decideCalls()).isEqualTo(1);
        assertThat(decision.action()).isEqualTo(ReplanAction.CONTINUE);
    }

    @Test
    void disabledRevisionShouldNeverConsultModel() {
        properties.setPlanRevisionEnabled(false);

        ReplanDecision decision = replanner.evaluate("p1", "Trip", STEPS,
                List.of(StepOutcome.failed("Search flights", "timeout")), 1);

        assertThat(decision.action()).isEqualTo(ReplanAction.CONTINUE);
        assertThat(engine.decideCalls()).isZero();
    }

    @Test
    void failureMarkerShouldIdentifyFailedOutcomes() {
        StepOutcome failed = StepOutcome.failed("Book hotel", "sold out");

        assertThat(failed.isFailure()).isTrue();
        assertThat(failed.result()).startsWith(StepOutcome.ERROR_MARKER);
        assertThat(new StepOutcome("Book hotel", "booked").isFailure()).isFalse();
    }
}
