package com.linlay.taskrunner.agent.middleware;

import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;

/**
 * Observer on the path between the execution modes and the caller.
 */
public interface AgentMiddleware {

    /**
     * @return the event to pass on, possibly replaced, or {@code null} to suppress it
     */
    default AgentEvent onEvent(AgentEvent event, RunContext context) {
        return event;
    }

    default void onRunStart(RunContext context) {
    }

    default void onRunEnd(RunContext context) {
    }
}
