package com.openforge.storeagent.agent;

import com.openforge.storeagent.config.AppConfig;
import com.openforge.storeagent.domain.ChatMessage;
import com.openforge.storeagent.domain.ChatMessage.Role;
import com.openforge.storeagent.llm.model.Message;
import com.openforge.storeagent.repository.ChatMessageRepository;
import com.openforge.storeagent.repository.ChatSessionRepository;
import com.openforge.storeagent.support.MutableClock;
import com.openforge.storeagent.websocket.ChatEventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatHistoryServiceTest {

    private static final String SYSTEM = "You are a test assistant.";

    private final ChatMessageRepository messageRepository = mock(ChatMessageRepository.class);

    private final ChatHistoryService history = new ChatHistoryService(
            messageRepository,
            mock(ChatSessionRepository.class),
            mock(ChatEventPublisher.class),
            new AppConfig().objectMapper(),
            new ChatProperties(10, 6, false, 50, SYSTEM),
            new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));

    private final List<ChatMessage> messages = new ArrayList<>();

    private void add(Role role, String json) {
        ChatMessage message = ChatMessage.builder().sessionId(1L).role(role).content(json).build();
        message.setId((long) messages.size() + 1);
        messages.add(message);
    }

    @Test
    @DisplayName("tool invocations fold into the assistant message that precedes them")
    void foldsToolCalls() {
        add(Role.USER, "{\"text\":\"where is order 1001?\"}");
        add(Role.ASSISTANT, "{\"text\":\"Let me check.\"}");
        add(Role.TOOL_INVOCATION, "{\"id\":\"call_1\",\"name\":\"get_order\",\"input\":{\"order_id\":\"1001\"}}");
        add(Role.TOOL_INVOCATION, "{\"id\":\"call_2\",\"name\":\"get_customer\",\"input\":{\"customer_id\":7}}");
        add(Role.TOOL_RESULT, "{\"tool_use_id\":\"call_1\",\"tool_name\":\"get_order\",\"content\":{\"status\":\"shipped\"},\"is_error\":false}");
        add(Role.TOOL_RESULT, "{\"tool_use_id\":\"call_2\",\"tool_name\":\"get_customer\",\"content\":\"Jane\",\"is_error\":false}");
        add(Role.ASSISTANT, "{\"text\":\"It shipped to Jane.\"}");

        List<Message> out = history.toLlmMessages(messages, SYSTEM);

        assertThat(out).extracting(Message::role)
                .containsExactly("system", "user", "assistant", "tool", "tool", "assistant");
        Message assistant = out.get(2);
        assertThat(assistant.content()).isEqualTo("Let me check.");
        assertThat(assistant.toolCalls()).extracting(c -> c.function().name()).containsExactly("get_order", "get_customer");
        assertThat(assistant.toolCalls().get(0).function().arguments()).isEqualTo("{\"order_id\":\"1001\"}");
        assertThat(out.get(3).toolCallId()).isEqualTo("call_1");
        assertThat(out.get(3).content()).isEqualTo("{\"status\":\"shipped\"}");
        assertThat(out.get(4).content()).isEqualTo("Jane");
    }

    @Test
    @DisplayName("an invocation without assistant text becomes a content-less assistant message")
    void invocationWithoutText() {
        add(Role.USER, "{\"text\":\"refund 1001\"}");
        add(Role.TOOL_INVOCATION, "{\"id\":\"call_9\",\"name\":\"issue_refund\",\"input\":{}}");

        List<Message> out = history.toLlmMessages(messages, SYSTEM);

        assertThat(out.get(2).content()).isNull();
        assertThat(out.get(2).toolCalls()).hasSize(1);
    }

    @Test
    @DisplayName("the outcome of an approved write arrives as an update note after the placeholder")
    void lateOutcomeBecomesNote() {
        add(Role.USER, "{\"text\":\"refund 1001\"}");
        add(Role.TOOL_INVOCATION, "{\"id\":\"call_9\",\"name\":\"issue_refund\",\"input\":{\"order_id\":\"1001\"}}");
        add(Role.TOOL_RESULT, "{\"tool_use_id\":\"call_9\",\"tool_name\":\"issue_refund\","
                + "\"content\":{\"status\":\"awaiting_approval\"},\"is_error\":false,\"awaiting_approval\":true}");
        add(Role.ASSISTANT, "{\"text\":\"Queued for approval.\"}");
        add(Role.TOOL_RESULT, "{\"tool_use_id\":\"call_9\",\"tool_name\":\"issue_refund\","
                + "\"content\":{\"refund_id\":\"rf_1\"},\"is_error\":false}");

        List<Message> out = history.toLlmMessages(messages, SYSTEM);

        assertThat(out).extracting(Message::role)
                .containsExactly("system", "user", "assistant", "tool", "assistant", "system");
        assertThat(out.get(5).content())
                .isEqualTo("Update on the earlier issue_refund call (call_9): {\"refund_id\":\"rf_1\"}");
    }

    @Test
    @DisplayName("long histories are cut at a user message")
    void truncatesAtUserMessage() {
        add(Role.USER, "{\"text\":\"first\"}");
        add(Role.ASSISTANT, "{\"text\":\"one\"}");
        add(Role.USER, "{\"text\":\"second\"}");
        add(Role.TOOL_INVOCATION, "{\"id\":\"c1\",\"name\":\"get_order\",\"input\":{}}");
        add(Role.TOOL_RESULT, "{\"tool_use_id\":\"c1\",\"tool_name\":\"get_order\",\"content\":{},\"is_error\":false}");
        add(Role.ASSISTANT, "{\"text\":\"two\"}");
        add(Role.USER, "{\"text\":\"third\"}");
        add(Role.ASSISTANT, "{\"text\":\"three\"}");
        when(messageRepository.findBySessionIdOrderByIdAsc(1L)).thenReturn(messages);

        List<Message> out = history.toLlmMessages(1L);

        assertThat(out.get(0).content()).isEqualTo(SYSTEM);
        assertThat(out.get(1).role()).isEqualTo("user");
        assertThat(out.get(1).content()).isEqualTo("second");
        assertThat(out).hasSize(1 + 6);
    }
}
