package com.linlay.taskrunner.llm;

import com.linlay.taskrunner.agent.PromptContext;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.tool.BaseTool;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * The reasoning capability the orchestration core drives. Implementations own the model loop
 * and tool execution; the core only sees raw events and structured decisions.
 */
public interface ReasoningEngine {

    /**
     * Runs a reasoning session with the given tools bound. The returned flux errors with
     * {@link com.linlay.taskrunner.agent.runtime.RecursionLimitExceededException} when more than
     * {@code recursionLimit} super-steps are needed.
     */
    Flux<RawEngineEvent> stream(PromptContext prompt, List<BaseTool> tools, int recursionLimit, RunContext context);

    /**
     * One structured-output call. Throws on capability failure or unparseable output.
     */
    <T> T decide(String prompt, Class<T> type);

    default String modelName() {
        return "unknown";
    }
}
