package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.agent.stream.AdapterOptions;
import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.Plan;
import com.linlay.taskrunner.model.PlanStep;
import com.linlay.taskrunner.model.ReplanDecision;
import com.linlay.taskrunner.model.StepStatus;
import com.linlay.taskrunner.tool.BaseTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Planned execution: each step runs in its own executor session, strictly one after another,
 * with the {@link Replanner} consulted in between. A failed step does not end the run.
 */
public final class PlanMode extends AgentMode {

    private static final Logger log = LoggerFactory.getLogger(PlanMode.class);

    private final Plan plan;

    public PlanMode(ModeServices services, PromptContext prompt, Plan plan) {
        super(services, prompt);
        this.plan = plan;
    }

    @Override
    public String name() {
        return "plan";
    }

    public Plan plan() {
        return plan;
    }

    @Override
    public Flux<AgentEvent> execute(RunContext context) {
        return Flux.<AgentEvent>create(sink -> {
                    try {
                        run(context, sink);
                        if (!sink.isCancelled()) {
                            sink.complete();
                        }
                    } catch (Exception ex) {
                        log.error("[plan:{}] plan execution aborted", plan.planId(), ex);
                        services.emit(sink, AgentEvent.error(describe(ex)));
                        if (!sink.isCancelled()) {
                            sink.complete();
                        }
                    }
                }, FluxSink.OverflowStrategy.BUFFER)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void run(RunContext context, FluxSink<AgentEvent> sink) {
        context.bindOwner();
        AgentRunProperties properties = services.properties();
        String planId = plan.planId();
        List<PlanStep> steps = new ArrayList<>(plan.steps());
        List<StepOutcome> pastSteps = new ArrayList<>();
        List<BaseTool> executorTools = services.toolRegistry().executorTools();
        AdapterOptions baseOptions = services.adapterOptions();
        int stepIndex = 0;

        log.info("[plan:{}] executing '{}' with {} steps", planId, plan.title(), steps.size());
        while (stepIndex < steps.size() && stepIndex < properties.getPlanMaxSteps()) {
            if (context.isCancelled() || sink.isCancelled()) {
                log.info("[plan:{}] cancelled before step {}", planId, stepIndex + 1);
                return;
            }
            PlanStep step = steps.get(stepIndex);
            markRunning(steps, stepIndex, planId, context, sink);

            String executorPrompt = PlanPromptBuilder.executorPrompt(
                    properties.getSystemPrompt(), plan.title(), step.title(), stepIndex, steps.size(),
                    pastSteps, properties.getStepSummaryMaxChars());
            String stepMessage = PlanPromptBuilder.stepMessage(stepIndex, step.title());
            AdapterOptions options = baseOptions.forExecutor(executorPrompt, stepMessage);

            StringBuilder response = new StringBuilder();
            try {
                Flux<AgentEvent> session = services.adaptedStream(
                        prompt.forStep(executorPrompt, stepMessage), executorTools,
                        properties.getExecutorRecursionLimit(), context, options);
                for (AgentEvent event : session.toIterable()) {
                    if (event instanceof AgentEvent.Token token) {
                        response.append(token.content());
                    }
                    services.emit(sink, event);
                    if (sink.isCancelled()) {
                        return;
                    }
                }
                services.emitStrayPlanEvents(sink, context);
                steps.set(stepIndex, step.withStatus(StepStatus.COMPLETED));
                services.emit(sink, AgentEvent.planUpdated(planId, step.id(), StepStatus.COMPLETED));
                pastSteps.add(new StepOutcome(step.title(),
                        PlanPromptBuilder.truncate(response.toString(), properties.getStepResultMaxChars())));
            } catch (Exception ex) {
                Throwable cause = Exceptions.unwrap(ex);
                String message = describe(cause);
                log.error("[plan:{}] step {} '{}' failed, model={}", planId, stepIndex + 1, step.title(),
                        services.engine().modelName(), cause);
                services.emitStrayPlanEvents(sink, context);
                services.emit(sink,
                        AgentEvent.token("\n\n> Step " + (stepIndex + 1) + " failed: " + message + "\n"));
                steps.set(stepIndex, step.withStatus(StepStatus.FAILED));
                services.emit(sink, AgentEvent.planUpdated(planId, step.id(), StepStatus.FAILED));
                pastSteps.add(new StepOutcome(step.title(), PlanPromptBuilder.truncate(
                        StepOutcome.failed(step.title(), message).result(),
                        properties.getStepResultMaxChars())));
            }
            stepIndex++;

            if (stepIndex >= steps.size()) {
                continue;
            }
            ReplanDecision decision = services.replanner().evaluate(planId, plan.title(), steps, pastSteps, stepIndex);
            switch (decision.action()) {
                case FINISH -> {
                    for (int i = stepIndex; i < steps.size(); i++) {
                        PlanStep skipped = steps.get(i);
                        steps.set(i, skipped.withStatus(StepStatus.COMPLETED));
                        services.emit(sink, AgentEvent.planUpdated(planId, skipped.id(), StepStatus.COMPLETED));
                    }
                    if (!decision.response().isBlank()) {
                        services.emit(sink, AgentEvent.token("\n\n" + decision.response()));
                    }
                    log.info("[plan:{}] finished early after step {}", planId, stepIndex);
                    stepIndex = steps.size();
                }
                case REVISE -> {
                    List<String> titles = decision.revisedSteps().stream()
                            .map(String::trim)
                            .filter(title -> !title.isEmpty())
                            .toList();
                    if (!titles.isEmpty()) {
                        List<PlanStep> revised = Plan.numberedSteps(stepIndex, titles);
                        services.emit(sink,
                                AgentEvent.planRevised(planId, revised, stepIndex, decision.reason()));
                        List<PlanStep> next = new ArrayList<>(steps.subList(0, stepIndex));
                        next.addAll(revised);
                        steps = next;
                        log.info("[plan:{}] revised from step {}: {} new steps", planId, stepIndex + 1, revised.size());
                    }
                }
                case CONTINUE -> {
                    // keep going
                }
            }
        }
        if (stepIndex < steps.size()) {
            log.warn("[plan:{}] stopped at step ceiling {}, {} steps left", planId,
                    properties.getPlanMaxSteps(), steps.size() - stepIndex);
        }
        services.emit(sink, AgentEvent.done());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * Marks the step running. Earlier steps still pending are force-completed first; they are
     * not checked for having actually run.
     */
    private void markRunning(List<PlanStep> steps, int stepIndex, String planId, RunContext context,
                             FluxSink<AgentEvent> sink) {
        for (int i = 0; i < stepIndex; i++) {
            PlanStep earlier = steps.get(i);
            if (earlier.status() == StepStatus.PENDING) {
                steps.set(i, earlier.withStatus(StepStatus.COMPLETED));
                services.emit(sink, AgentEvent.planUpdated(planId, earlier.id(), StepStatus.COMPLETED));
            }
        }
        PlanStep step = steps.get(stepIndex);
        steps.set(stepIndex, step.withStatus(StepStatus.RUNNING));
        services.emit(sink, AgentEvent.planUpdated(planId, step.id(), StepStatus.RUNNING));
    }
}
