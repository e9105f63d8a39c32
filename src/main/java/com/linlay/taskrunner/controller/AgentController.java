package com.linlay.taskrunner.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.linlay.taskrunner.agent.AgentRunner;
import com.linlay.taskrunner.agent.middleware.AgentMiddleware;
import com.linlay.taskrunner.agent.runtime.PlanApprovalCoordinator;
import com.linlay.taskrunner.agent.runtime.RunContext;
import com.linlay.taskrunner.model.AgentEvent;
import com.linlay.taskrunner.model.api.ApiResponse;
import com.linlay.taskrunner.model.api.ApprovalRequest;
import com.linlay.taskrunner.model.api.ApprovalResponse;
import com.linlay.taskrunner.model.api.ChatRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

@RestController
@RequestMapping("/api")
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final AgentRunner agentRunner;
    private final PlanApprovalCoordinator planApprovalCoordinator;
    private final List<AgentMiddleware> middlewares;
    private final ObjectWriter eventWriter;

    public AgentController(
            AgentRunner agentRunner,
            PlanApprovalCoordinator planApprovalCoordinator,
            ObjectProvider<AgentMiddleware> middlewares,
            ObjectMapper objectMapper
    ) {
        this.agentRunner = agentRunner;
        this.planApprovalCoordinator = planApprovalCoordinator;
        this.middlewares = middlewares.orderedStream().toList();
        this.eventWriter = objectMapper.writerFor(AgentEvent.class);
    }

    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> chat(@Valid @RequestBody ChatRequest request) {
        RunContext context = new RunContext(request.sessionId(), request.debugEnabled(), true);
        log.info("[run:{}] chat request runId={}, historyTurns={}", context.sessionId(), context.runId(),
                request.history().size());
        return agentRunner.run(request.message(), request.history(), context, middlewares)
                .map(this::toServerSentEvent);
    }

    @PostMapping("/plan/approve")
    public ApiResponse<ApprovalResponse> approve(@Valid @RequestBody ApprovalRequest request) {
        PlanApprovalCoordinator.SubmitAck ack = planApprovalCoordinator.submit(request.planId(), request.approved());
        log.info("Received plan decision planId={}, approved={}, accepted={}, status={}",
                request.planId(), request.approved(), ack.accepted(), ack.status());
        return ApiResponse.success(new ApprovalResponse(ack.accepted(), ack.status(), request.planId(), ack.detail()));
    }

    private ServerSentEvent<String> toServerSentEvent(AgentEvent event) {
        try {
            return ServerSentEvent.builder(eventWriter.writeValueAsString(event))
                    .event(event.type())
                    .build();
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize " + event.type() + " event", ex);
        }
    }
}
