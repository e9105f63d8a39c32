package com.linlay.taskrunner.agent.middleware;

import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
@Order(0)
public class EventLoggingMiddleware implements AgentMiddleware {

    private static final Logger log = LoggerFactory.getLogger(EventLoggingMiddleware.class);

    private final Map<String, AtomicInteger> countsByRun = new ConcurrentHashMap<>();

    @Override
    public void onRunStart(RunContext context) {
        countsByRun.put(context.runId(), new AtomicInteger());
        log.info("[run:{}] start runId={}, historyTurns={}", context.sessionId(), context.runId(),
                context.history().size());
    }

    @Override
    public AgentEvent onEvent(AgentEvent event, RunContext context) {
        AtomicInteger count = countsByRun.get(context.runId());
        if (count != null) {
            count.incrementAndGet();
        }
        if (event instanceof AgentEvent.Error error) {
            log.warn("[run:{}] error event: {}", context.sessionId(), error.content());
        } else if (log.isDebugEnabled() && !(event instanceof AgentEvent.Token)) {
            log.debug("[run:{}] event {}", context.sessionId(), event.type());
        }
        return event;
    }

    @Override
    public void onRunEnd(RunContext context) {
        AtomicInteger count = countsByRun.remove(context.runId());
        log.info("[run:{}] end runId={}, events={}, tools={}, plan={}", context.sessionId(), context.runId(),
                count == null ? 0 : count.get(), context.toolRecords().size(),
                context.hasPlan() ? context.plan().planId() : "-");
    }
}
