package com.linlay.taskrunner.agent.runtime;

import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.Plan;
import com.linlay.taskrunner.model.ToolCallRecord;
import com.linlay.taskrunner.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-request state. Created by the caller, mutated by the runner and the execution modes, and
 * dropped once the response stream has been fully flushed.
 */
public class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String sessionId;
    private final String runId;
    private final boolean debug;
    private final boolean stream;

    private final RunChannel<AgentEvent> planEvents = new RunChannel<>("plan-events");
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean approvalAwaited = new AtomicBoolean(false);
    private final List<ToolCallRecord> toolRecords = new CopyOnWriteArrayList<>();
    private final List<AgentEvent> engineEvents = new CopyOnWriteArrayList<>();
    private final AtomicInteger sideChannelCursor = new AtomicInteger();

    private String message = "";
    private List<Turn> history = List.of();
    private volatile Plan plan;
    private volatile Thread owner;

    public RunContext(String sessionId) {
        this(sessionId, false, true);
    }

    public RunContext(String sessionId, boolean debug, boolean stream) {
        this.sessionId = StringUtils.hasText(sessionId) ? sessionId.trim() : "default";
        this.runId = "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        this.debug = debug;
        this.stream = stream;
    }

    public String sessionId() {
        return sessionId;
    }

    public String runId() {
        return runId;
    }

    public boolean debug() {
        return debug;
    }

    public boolean stream() {
        return stream;
    }

    public String message() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message == null ? "" : message;
    }

    public List<Turn> history() {
        return history;
    }

    public void setHistory(List<Turn> history) {
        this.history = history == null ? List.of() : List.copyOf(history);
    }

    public Plan plan() {
        return plan;
    }

    public boolean hasPlan() {
        return plan != null;
    }

    public void capturePlan(Plan plan) {
        if (this.plan != null && plan != null) {
            log.info("[run:{}] replacing active plan {} with {}", sessionId, this.plan.planId(), plan.planId());
        }
        this.plan = plan;
    }

    /**
     * Marks the calling thread as the one driving this run. Deliveries from other threads still
     * go through the channels and surface at the owner's next drain.
     */
    public void bindOwner() {
        this.owner = Thread.currentThread();
    }

    public boolean isOwnerThread() {
        Thread current = owner;
        return current == null || current == Thread.currentThread();
    }

    /**
     * Thread-safe publish point for plan events. Never throws: a failed publish is logged and
     * dropped so it cannot disturb the caller (usually a tool).
     */
    public void emitPlanEvent(AgentEvent event) {
        if (event == null) {
            return;
        }
        try {
            if (!isOwnerThread()) {
                log.debug("[run:{}] {} delivered from foreign thread {}", sessionId, event.type(), Thread.currentThread().getName());
            }
            if (!planEvents.deliver(event)) {
                log.warn("[run:{}] plan event {} was not accepted by channel", sessionId, event.type());
            }
        } catch (RuntimeException ex) {
            log.warn("[run:{}] failed to publish plan event {}", sessionId, event.type(), ex);
        }
    }

    public List<AgentEvent> drainPlanEvents() {
        return planEvents.drain();
    }

    /**
     * @return {@code true} only for the first caller; the approval gate is awaited at most once.
     */
    public boolean markApprovalAwaited() {
        return approvalAwaited.compareAndSet(false, true);
    }

    public boolean approvalAwaited() {
        return approvalAwaited.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("[run:{}] cancellation requested", sessionId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public int sideChannelCursor() {
        return sideChannelCursor.get();
    }

    /**
     * Moves the side-channel cursor forward. It never moves backwards within a run.
     */
    public void advanceSideChannelCursor(int surfaced) {
        sideChannelCursor.accumulateAndGet(surfaced, Math::max);
    }

    /**
     * Appends to the run-wide list of events the reasoning engine produced on its own. The list
     * only grows; the adapter surfaces it by suffix against {@link #sideChannelCursor()}.
     */
    public void appendEngineEvent(AgentEvent event) {
        if (event != null) {
            engineEvents.add(event);
        }
    }

    public List<AgentEvent> engineEvents() {
        return List.copyOf(engineEvents);
    }

    public void recordToolStart(String callId, String tool, Map<String, Object> input) {
        toolRecords.add(ToolCallRecord.started(callId, tool, input));
    }

    public void recordToolEnd(String callId, String output) {
        for (int i = toolRecords.size() - 1; i >= 0; i--) {
            ToolCallRecord record = toolRecords.get(i);
            if (!record.isCompleted() && callId != null && callId.equals(record.callId())) {
                toolRecords.set(i, record.completed(output));
                return;
            }
        }
    }

    public List<ToolCallRecord> toolRecords() {
        return List.copyOf(toolRecords);
    }
}
