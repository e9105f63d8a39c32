package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.tool.PlanCreateTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

/**
 * Unplanned execution: one reasoning session over every tool. Stops right after a successful
 * plan declaration so the runner can switch to {@link PlanMode}.
 */
public final class DirectMode extends AgentMode {

    private static final Logger log = LoggerFactory.getLogger(DirectMode.class);

    public DirectMode(ModeServices services, PromptContext prompt) {
        super(services, prompt);
    }

    @Override
    public String name() {
        return "direct";
    }

    @Override
    public Flux<AgentEvent> execute(RunContext context) {
        return Flux.defer(() -> {
                    int limit = services.properties().getRecursionLimit();
                    log.debug("[run:{}] direct mode start, recursionLimit={}", context.sessionId(), limit);
                    return services.adaptedStream(prompt, services.toolRegistry().list(), limit, context,
                                    services.adapterOptions())
                            .takeUntil(event -> isPlanHandoff(event, context));
                })
                .concatWith(Flux.defer(() -> Flux.fromIterable(context.drainPlanEvents())))
                .onErrorResume(ex -> {
                    Throwable cause = Exceptions.unwrap(ex);
                    log.error("[run:{}] direct mode failed, model={}", context.sessionId(),
                            services.engine().modelName(), cause);
                    return Flux.fromIterable(context.drainPlanEvents())
                            .concatWith(Flux.just(AgentEvent.error(errorText(cause))));
                });
    }

    static boolean isPlanHandoff(AgentEvent event, RunContext context) {
        return event instanceof AgentEvent.ToolEnd toolEnd
                && PlanCreateTool.NAME.equals(toolEnd.tool())
                && context.hasPlan();
    }

    private static String errorText(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
