package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import reactor.core.publisher.Flux;

/**
 * An execution phase of a run. The returned flux is lazy and meant for a single subscriber.
 */
public sealed abstract class AgentMode
        permits DirectMode, PlanMode {

    protected final ModeServices services;
    protected final PromptContext prompt;

    protected AgentMode(ModeServices services, PromptContext prompt) {
        this.services = services;
        this.prompt = prompt;
    }

    public abstract String name();

    public PromptContext prompt() {
        return prompt;
    }

    public abstract Flux<AgentEvent> execute(RunContext context);
}
