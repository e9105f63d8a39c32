package com.linlay.taskrunner.agent.middleware;

import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Keeps model-call diagnostics ({@code llm_start}, {@code llm_end}) on the wire only for runs that
 * asked for them with {@code "debug": true}.
 */
@Component
@Order(10)
public class DebugMiddleware implements AgentMiddleware {

    @Override
    public AgentEvent onEvent(AgentEvent event, RunContext context) {
        if (context.debug()) {
            return event;
        }
        if (event instanceof AgentEvent.LlmStart || event instanceof AgentEvent.LlmEnd) {
            return null;
        }
        return event;
    }
}
