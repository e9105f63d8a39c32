package com.linlay.taskrunner.agent.mode;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.agent.stream.AdapterOptions;
import com.linlay.taskrunner.agent.stream.EventStreamAdapter;
import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.llm.ReasoningEngine;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.tool.BaseTool;
import com.linlay.taskrunner.tool.ToolRegistry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.List;

/**
 * Collaborators shared by the execution modes.
 */
public class ModeServices {

    private final ReasoningEngine engine;
    private final ToolRegistry toolRegistry;
    private final AgentRunProperties properties;
    private final Replanner replanner;

    public ModeServices(ReasoningEngine engine, ToolRegistry toolRegistry, AgentRunProperties properties) {
        this.engine = engine;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.replanner = new Replanner(engine, properties);
    }

    public ReasoningEngine engine() {
        return engine;
    }

    public ToolRegistry toolRegistry() {
        return toolRegistry;
    }

    public AgentRunProperties properties() {
        return properties;
    }

    public Replanner replanner() {
        return replanner;
    }

    public AdapterOptions adapterOptions() {
        return AdapterOptions.from(properties, engine.modelName());
    }

    public Flux<AgentEvent> adaptedStream(
            PromptContext prompt,
            List<BaseTool> tools,
            int recursionLimit,
            RunContext context,
            AdapterOptions options
    ) {
        return EventStreamAdapter.adapt(engine.stream(prompt, tools, recursionLimit, context), context, options);
    }

    public void emit(FluxSink<AgentEvent> sink, AgentEvent event) {
        if (event != null && !sink.isCancelled()) {
            sink.next(event);
        }
    }

    /**
     * Plan events published outside any tool call, for example from a foreign thread, surfaced
     * at the end of a session.
     */
    public void emitStrayPlanEvents(FluxSink<AgentEvent> sink, RunContext context) {
        for (AgentEvent event : context.drainPlanEvents()) {
            emit(sink, event);
        }
    }
}
