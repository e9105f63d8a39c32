package com.linlay.taskrunner.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskrunner.model.ToolCallRecord;
import com.linlay.taskrunner.model.Turn;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns stored conversation turns into Spring AI messages. An assistant turn that used tools
 * becomes an assistant message carrying the calls, followed by one tool response per call, so the
 * model sees the complete exchange.
 */
public class HistoryMessageConverter {

    private final ObjectMapper objectMapper;

    public HistoryMessageConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Message> toMessages(List<Turn> history) {
        List<Message> messages = new ArrayList<>();
        if (history == null) {
            return messages;
        }
        for (Turn turn : history) {
            if (turn.role() == Turn.Role.USER) {
                messages.add(new UserMessage(turn.content()));
                continue;
            }
            if (turn.toolCalls().isEmpty()) {
                messages.add(new AssistantMessage(turn.content()));
                continue;
            }
            List<AssistantMessage.ToolCall> toolCalls = new ArrayList<>();
            List<ToolResponseMessage> responses = new ArrayList<>();
            for (int i = 0; i < turn.toolCalls().size(); i++) {
                ToolCallRecord record = turn.toolCalls().get(i);
                String tool = StringUtils.hasText(record.tool()) ? record.tool() : "unknown";
                String callId = StringUtils.hasText(record.callId()) ? record.callId() : "call_" + i + "_" + tool;
                toolCalls.add(new AssistantMessage.ToolCall(callId, "function", tool, arguments(record.input())));
                responses.add(new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                        callId, tool, record.output() == null ? "" : record.output()))));
            }
            messages.add(new AssistantMessage(turn.content(), Map.of(), toolCalls));
            messages.addAll(responses);
        }
        return messages;
    }

    private String arguments(Map<String, Object> input) {
        try {
            return objectMapper.writeValueAsString(input == null ? Map.of() : input);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Tool call input is not serializable", ex);
        }
    }
}
