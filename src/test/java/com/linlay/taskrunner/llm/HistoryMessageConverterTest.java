package com.linlay.taskrunner.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.taskrunner.model.ToolCallRecord;
import com.linlay.taskrunner.model.Turn;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryMessageConverterTest {

    private final HistoryMessageConverter converter = new HistoryMessageConverter(new ObjectMapper());

    @Test
    void plainTurnsShouldMapToUserAndAssistantMessages() {
        List<Message> messages = converter.toMessages(List.of(Turn.user("hi"), Turn.assistant("hello")));

        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(0).getText()).isEqualTo("hi");
        assertThat(messages.get(1)).isInstanceOf(AssistantMessage.class);
        assertThat(messages.get(1).getText()).isEqualTo("hello");
    }

    @Test
    void assistantTurnWithToolsShouldBeFollowedByToolResponses() {
        Turn turn = Turn.assistant("Checking the weather", List.of(
                new ToolCallRecord("call_a", "weather", Map.of("city", "Rome"), "sunny"),
                new ToolCallRecord(null, "clock", Map.of(), null)
        ));

        List<Message> messages = converter.toMessages(List.of(Turn.user("weather?"), turn));

        assertThat(messages).hasSize(4);
        AssistantMessage assistant = (AssistantMessage) messages.get(1);
        assertThat(assistant.getToolCalls()).extracting(AssistantMessage.ToolCall::id)
                .containsExactly("call_a", "call_1_clock");
        assertThat(assistant.getToolCalls().get(0).arguments()).isEqualTo("{\"city\":\"Rome\"}");
        ToolResponseMessage first = (ToolResponseMessage) messages.get(2);
        assertThat(first.getResponses()).singleElement()
                .satisfies(response -> {
                    assertThat(response.id()).isEqualTo("call_a");
                    assertThat(response.responseData()).isEqualTo("sunny");
                });
        ToolResponseMessage second = (ToolResponseMessage) messages.get(3);
        assertThat(second.getResponses().get(0).responseData()).isEmpty();
    }

    @Test
    void missingHistoryShouldYieldNoMessages() {
        assertThat(converter.toMessages(null)).isEmpty();
    }
}
