package com.linlay.taskrunner.agent;

import com.linlay.taskrunner.agent.middleware.AgentMiddleware;
import com.linlay.taskrunner.agent.middleware.MiddlewarePipeline;
import com.linlay.taskrunner.agent.mode.DirectMode;
import com.linlay.taskrunner.agent.mode.ModeServices;
import com.linlay.taskrunner.agent.mode.PlanMode;
import com.linlay.taskrunner.agent.runtime.PlanApprovalCoordinator;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.cache.RunCacheKeyFactory;
import com.linlay.taskrunner.cache.RunEventCache;
import com.linlay.taskrunner.config.AgentProviderProperties;
import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.config.RunCacheProperties;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.Plan;
import com.linlay.taskrunner.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for one request: direct execution, then (if a plan was declared) the optional
 * approval gate and planned execution. Every event goes through the middleware chain.
 */
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    static final String REJECTION_TEXT = "\n\nThe user rejected the plan.";

    private final ModeServices services;
    private final PlanApprovalCoordinator approvalCoordinator;
    private final RunEventCache cache;
    private final RunCacheKeyFactory cacheKeyFactory;
    private final RunCacheProperties cacheProperties;
    private final AgentProviderProperties providerProperties;

    public AgentRunner(
            ModeServices services,
            PlanApprovalCoordinator approvalCoordinator,
            RunEventCache cache,
            RunCacheKeyFactory cacheKeyFactory,
            RunCacheProperties cacheProperties,
            AgentProviderProperties providerProperties
    ) {
        this.services = services;
        this.approvalCoordinator = approvalCoordinator;
        this.cache = cache;
        this.cacheKeyFactory = cacheKeyFactory;
        this.cacheProperties = cacheProperties;
        this.providerProperties = providerProperties;
    }

    public Flux<AgentEvent> run(String message, List<Turn> history, RunContext context, List<AgentMiddleware> middlewares) {
        MiddlewarePipeline pipeline = new MiddlewarePipeline(middlewares);
        return Flux.defer(() -> {
                    context.setMessage(message);
                    context.setHistory(history);
                    pipeline.runStart(context);
                    return cacheProperties.isEnabled() && cache != null
                            ? cachedRun(context, pipeline)
                            : uncachedRun(context, pipeline);
                })
                .doOnCancel(context::cancel)
                .doFinally(signalType -> pipeline.runEnd(context));
    }

    private Flux<AgentEvent> cachedRun(RunContext context, MiddlewarePipeline pipeline) {
        String key;
        Optional<List<AgentEvent>> hit;
        try {
            key = cacheKeyFactory.key(
                    services.properties().getSystemPrompt(),
                    context.history(),
                    context.message(),
                    services.engine().modelName(),
                    providerProperties.getTemperature()
            );
            hit = cache.get(key);
        } catch (RuntimeException ex) {
            log.warn("[run:{}] run cache lookup failed, running uncached", context.sessionId(), ex);
            return uncachedRun(context, pipeline);
        }
        if (hit.isPresent()) {
            log.info("[run:{}] run cache hit, replaying {} events", context.sessionId(), hit.get().size());
            return Flux.fromIterable(hit.get());
        }

        List<AgentEvent> collected = new ArrayList<>();
        return uncachedRun(context, pipeline)
                .doOnNext(collected::add)
                .doOnComplete(() -> store(key, collected, context));
    }

    private void store(String key, List<AgentEvent> events, RunContext context) {
        if (context.approvalAwaited() || events.isEmpty()
                || !(events.get(events.size() - 1) instanceof AgentEvent.Done)
                || events.stream().anyMatch(AgentEvent.Error.class::isInstance)) {
            log.debug("[run:{}] run not cacheable", context.sessionId());
            return;
        }
        try {
            cache.put(key, events);
        } catch (RuntimeException ex) {
            log.warn("[run:{}] failed to store run in cache", context.sessionId(), ex);
        }
    }

    private Flux<AgentEvent> uncachedRun(RunContext context, MiddlewarePipeline pipeline) {
        PromptContext prompt = PromptContext.of(
                services.properties().getSystemPrompt(), context.history(), context.message());
        AtomicBoolean directFailed = new AtomicBoolean(false);
        Flux<AgentEvent> direct = new DirectMode(services, prompt).execute(context)
                .doOnNext(event -> {
                    if (event instanceof AgentEvent.Error) {
                        directFailed.set(true);
                    }
                });
        return pipeline.pipe(direct, context)
                .concatWith(Flux.defer(() -> {
                    if (directFailed.get()) {
                        return Flux.empty();
                    }
                    if (!context.hasPlan()) {
                        return pipeline.pipe(Flux.just(AgentEvent.done()), context);
                    }
                    return afterPlanDeclared(context, pipeline, prompt);
                }));
    }

    private Flux<AgentEvent> afterPlanDeclared(RunContext context, MiddlewarePipeline pipeline, PromptContext prompt) {
        Plan plan = context.plan();
        AgentRunProperties properties = services.properties();
        if (!properties.isPlanRequireApproval()) {
            return planPhase(context, pipeline, prompt, plan);
        }
        Flux<AgentEvent> decision = approvalCoordinator.awaitDecision(context)
                .flatMapMany(approved -> {
                    if (approved) {
                        return planPhase(context, pipeline, prompt, plan);
                    }
                    log.info("[run:{}] plan {} rejected", context.sessionId(), plan.planId());
                    return pipeline.pipe(Flux.just(AgentEvent.token(REJECTION_TEXT), AgentEvent.done()), context);
                })
                .onErrorResume(ex -> {
                    log.error("[run:{}] approval gate failed for plan {}", context.sessionId(), plan.planId(), ex);
                    return pipeline.pipe(Flux.just(AgentEvent.error(ex.getMessage())), context);
                });
        return pipeline.pipe(Flux.just(AgentEvent.planApprovalRequest(plan)), context)
                .concatWith(decision);
    }

    private Flux<AgentEvent> planPhase(RunContext context, MiddlewarePipeline pipeline, PromptContext prompt, Plan plan) {
        return pipeline.pipe(new PlanMode(services, prompt, plan).execute(context), context);
    }
}
