package com.linlay.taskrunner.agent.runtime;

import com.linlay.taskrunner.config.AgentRunProperties;
import com.linlay.taskrunner.config.AgentRunProperties.UnattendedApproval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pairs plan approval decisions arriving over HTTP with the run that is suspended on them.
 */
@Component
public class PlanApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PlanApprovalCoordinator.class);

    private final AgentRunProperties properties;
    private final Map<String, CompletableFuture<Boolean>> pendingByPlanId = new ConcurrentHashMap<>();

    public PlanApprovalCoordinator(AgentRunProperties properties) {
        this.properties = properties;
    }

    /**
     * Suspends until the plan captured on {@code context} is approved or rejected. Emits
     * {@code true} for approval. Holds no thread while waiting; cancelling the subscription drops
     * the pending entry.
     */
    public Mono<Boolean> awaitDecision(RunContext context) {
        if (context == null || !context.hasPlan()) {
            return Mono.error(new IllegalStateException("No captured plan to approve"));
        }
        if (!context.markApprovalAwaited()) {
            return Mono.error(new IllegalStateException("Approval already awaited for run " + context.runId()));
        }
        String key = key(context.plan().planId());
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        CompletableFuture<Boolean> existed = pendingByPlanId.putIfAbsent(key, future);
        if (existed != null) {
            return Mono.error(new IllegalStateException("Pending plan approval already exists: " + key));
        }
        log.info("[run:{}] waiting for approval of plan {}", context.sessionId(), key);

        Mono<Boolean> decision = Mono.fromFuture(future)
                .doOnNext(approved -> log.info("[run:{}] plan {} {}", context.sessionId(), key,
                        approved ? "approved" : "rejected"));
        long timeoutMs = properties.getApprovalTimeoutMs();
        UnattendedApproval policy = properties.getUnattendedApproval();
        if (timeoutMs > 0 && policy != UnattendedApproval.WAIT) {
            decision = decision.timeout(Duration.ofMillis(timeoutMs), Mono.fromSupplier(() -> {
                log.warn("[run:{}] plan {} unattended after {}ms, applying policy {}",
                        context.sessionId(), key, timeoutMs, policy);
                return policy == UnattendedApproval.APPROVE;
            }));
        }
        return decision.doFinally(signalType -> pendingByPlanId.remove(key, future));
    }

    public SubmitAck submit(String planId, boolean approved) {
        String key = key(planId);
        CompletableFuture<Boolean> pending = pendingByPlanId.remove(key);
        if (pending == null) {
            return new SubmitAck(false, "unmatched", "No run is waiting on plan_id=" + key);
        }
        pending.complete(approved);
        return new SubmitAck(true, "accepted",
                "Plan " + (approved ? "approval" : "rejection") + " accepted for plan_id=" + key);
    }

    public boolean isPending(String planId) {
        return StringUtils.hasText(planId) && pendingByPlanId.containsKey(planId.trim());
    }

    private String key(String planId) {
        if (!StringUtils.hasText(planId)) {
            throw new IllegalArgumentException("plan_id is required");
        }
        return planId.trim();
    }

    public record SubmitAck(
            boolean accepted,
            String status,
            String detail
    ) {
    }
}
