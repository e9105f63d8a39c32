package com.linlay.taskrunner.agent.middleware;

import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Ordered middleware chain for one run.
 */
public final class MiddlewarePipeline {

    private static final Logger log = LoggerFactory.getLogger(MiddlewarePipeline.class);

    private final List<AgentMiddleware> middlewares;

    public MiddlewarePipeline(List<AgentMiddleware> middlewares) {
        this.middlewares = middlewares == null ? List.of() : List.copyOf(middlewares);
    }

    public static MiddlewarePipeline empty() {
        return new MiddlewarePipeline(List.of());
    }

    public List<AgentMiddleware> middlewares() {
        return middlewares;
    }

    /**
     * Runs one event through the chain. Returns {@code null} once any middleware suppresses it.
     */
    public AgentEvent apply(AgentEvent event, RunContext context) {
        AgentEvent processed = event;
        for (AgentMiddleware middleware : middlewares) {
            processed = middleware.onEvent(processed, context);
            if (processed == null) {
                return null;
            }
        }
        return processed;
    }

    public Flux<AgentEvent> pipe(Flux<AgentEvent> events, RunContext context) {
        return events.handle((event, sink) -> {
            AgentEvent processed = apply(event, context);
            if (processed != null) {
                sink.next(processed);
            }
        });
    }

    public void runStart(RunContext context) {
        for (AgentMiddleware middleware : middlewares) {
            middleware.onRunStart(context);
        }
    }

    /**
     * Calls every middleware even if an earlier one throws; failures are logged.
     */
    public void runEnd(RunContext context) {
        for (AgentMiddleware middleware : middlewares) {
            try {
                middleware.onRunEnd(context);
            } catch (RuntimeException ex) {
                log.warn("[run:{}] middleware {} failed on run end", context.sessionId(),
                        middleware.getClass().getSimpleName(), ex);
            }
        }
    }
}
