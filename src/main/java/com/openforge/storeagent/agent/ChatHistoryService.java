package com.openforge.storeagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.storeagent.agent.dto.MessageResponse;
import com.openforge.storeagent.agent.event.ChatEvent;
import com.openforge.storeagent.common.StorageException;
import com.openforge.storeagent.domain.ChatMessage;
import com.openforge.storeagent.domain.ChatMessage.Role;
import com.openforge.storeagent.llm.model.Message;
import com.openforge.storeagent.llm.model.ToolCall;
import com.openforge.storeagent.repository.ChatMessageRepository;
import com.openforge.storeagent.repository.ChatSessionRepository;
import com.openforge.storeagent.websocket.ChatEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only conversation log of a session, and its translation into the
 * message list of a completion request.
 *
 * Stored shapes (ChatMessage.content):
 *
 *   USER             {"text"}
 *   ASSISTANT        {"text", "error"?}
 *   TOOL_INVOCATION  {"id", "name", "input", "requires_approval", "route"?}
 *   TOOL_RESULT      {"tool_use_id", "tool_name", "content", "is_error",
 *                     "pending_action_id"?, "awaiting_approval"?}
 *
 * Replay rules:
 *   - an ASSISTANT text followed by TOOL_INVOCATIONs becomes one assistant
 *     message carrying those tool_calls
 *   - the first TOOL_RESULT for a call becomes a "tool" message
 *   - any later TOOL_RESULT for the same call (the outcome of an approved,
 *     rejected or expired write) becomes a system update note, since the
 *     call was already answered by its awaiting_approval placeholder
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatHistoryService {

    private final ChatMessageRepository messageRepository;
    private final ChatSessionRepository sessionRepository;
    private final ChatEventPublisher    eventPublisher;
    private final ObjectMapper          objectMapper;
    private final ChatProperties        properties;
    private final Clock                 clock;

    // ── Appends ──────────────────────────────────────────────────────────────

    public ChatMessage appendUser(Long sessionId, String text) {
        return append(sessionId, Role.USER, objectMapper.createObjectNode().put("text", text), null);
    }

    public ChatMessage appendAssistant(Long sessionId, String text, @Nullable ObjectNode interaction) {
        return append(sessionId, Role.ASSISTANT, objectMapper.createObjectNode().put("text", text), interaction);
    }

    /** Assistant message explaining why the turn ended without an answer. */
    public ChatMessage appendAssistantError(Long sessionId, String text) {
        ObjectNode content = objectMapper.createObjectNode().put("text", text).put("error", true);
        return append(sessionId, Role.ASSISTANT, content, null);
    }

    public ChatMessage appendToolInvocation(Long sessionId, ToolCall call, JsonNode input,
                                            boolean requiresApproval, @Nullable ObjectNode route,
                                            @Nullable ObjectNode interaction) {
        ObjectNode content = objectMapper.createObjectNode();
        content.put("id", call.id());
        content.put("name", call.function().name());
        content.set("input", input == null ? objectMapper.nullNode() : input);
        content.put("requires_approval", requiresApproval);
        if (route != null) {
            content.set("route", route);
        }
        return append(sessionId, Role.TOOL_INVOCATION, content, interaction);
    }

    public ChatMessage appendToolResult(Long sessionId, String toolUseId, String toolName, JsonNode result,
                                        boolean isError, @Nullable UUID pendingActionId, boolean awaitingApproval) {
        ObjectNode content = objectMapper.createObjectNode();
        content.put("tool_use_id", toolUseId);
        content.put("tool_name", toolName);
        content.set("content", result);
        content.put("is_error", isError);
        if (pendingActionId != null) {
            content.put("pending_action_id", pendingActionId.toString());
        }
        if (awaitingApproval) {
            content.put("awaiting_approval", true);
        }
        return append(sessionId, Role.TOOL_RESULT, content, null);
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    public List<ChatMessage> load(Long sessionId) {
        try {
            return messageRepository.findBySessionIdOrderByIdAsc(sessionId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load messages of session " + sessionId, e);
        }
    }

    public Optional<ChatMessage> find(@Nullable Long messageId) {
        if (messageId == null) return Optional.empty();
        try {
            return messageRepository.findById(messageId);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load message " + messageId, e);
        }
    }

    public JsonNode content(ChatMessage message) {
        return readTree(message.getContent());
    }

    public MessageResponse toResponse(ChatMessage message) {
        return new MessageResponse(
                message.getId(),
                message.getSessionId(),
                message.getRole().name().toLowerCase(),
                readTree(message.getContent()),
                message.getApiInteraction() == null ? null : readTree(message.getApiInteraction()),
                message.getCreateTime());
    }

    /** The most recent history of the session as completion messages, system prompt first. */
    public List<Message> toLlmMessages(Long sessionId) {
        return toLlmMessages(recent(load(sessionId)), properties.systemPrompt());
    }

    List<Message> toLlmMessages(List<ChatMessage> history, String systemPrompt) {
        List<Message> out = new ArrayList<>();
        out.add(Message.system(systemPrompt));

        Set<String> invoked  = new HashSet<>();
        Set<String> answered = new HashSet<>();
        PendingAssistant open = null;

        for (ChatMessage message : history) {
            JsonNode content = readTree(message.getContent());
            switch (message.getRole()) {
                case USER -> {
                    open = flush(open, out);
                    out.add(Message.user(content.path("text").asText("")));
                }
                case ASSISTANT -> {
                    open = flush(open, out);
                    open = new PendingAssistant(content.path("text").asText(null));
                }
                case TOOL_INVOCATION -> {
                    if (open == null) {
                        open = new PendingAssistant(null);
                    }
                    String id = content.path("id").asText();
                    invoked.add(id);
                    open.calls.add(ToolCall.function(id, content.path("name").asText(), content.path("input").toString()));
                }
                case TOOL_RESULT -> {
                    open = flush(open, out);
                    String id   = content.path("tool_use_id").asText();
                    String body = render(content.path("content"));
                    if (invoked.contains(id) && answered.add(id)) {
                        out.add(Message.toolResult(id, body));
                    } else {
                        out.add(Message.system("Update on the earlier %s call (%s): %s"
                                .formatted(content.path("tool_name").asText("tool"), id, body)));
                    }
                }
            }
        }
        flush(open, out);
        return out;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /** Last N messages, starting at a user message so no tool result loses its call. */
    private List<ChatMessage> recent(List<ChatMessage> all) {
        int max = properties.maxHistoryMessages();
        if (all.size() <= max) return all;
        List<ChatMessage> tail = all.subList(all.size() - max, all.size());
        for (int i = 0; i < tail.size(); i++) {
            if (tail.get(i).getRole() == Role.USER) {
                return tail.subList(i, tail.size());
            }
        }
        return tail;
    }

    private static PendingAssistant flush(@Nullable PendingAssistant open, List<Message> out) {
        if (open != null) {
            out.add(open.calls.isEmpty()
                    ? Message.assistantText(open.text == null ? "" : open.text)
                    : Message.assistant(open.text, List.copyOf(open.calls)));
        }
        return null;
    }

    private static String render(JsonNode node) {
        return node.isTextual() ? node.asText() : node.toString();
    }

    private ChatMessage append(Long sessionId, Role role, ObjectNode content, @Nullable ObjectNode interaction) {
        ChatMessage saved;
        try {
            saved = messageRepository.save(ChatMessage.builder()
                    .sessionId(sessionId)
                    .role(role)
                    .content(writeJson(content))
                    .apiInteraction(interaction == null ? null : writeJson(interaction))
                    .build());
            sessionRepository.touch(sessionId, LocalDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to append " + role + " message to session " + sessionId, e);
        }
        log.debug("[Chat:{}] +{} #{}", sessionId, role, saved.getId());
        eventPublisher.publish(ChatEvent.message(sessionId, toResponse(saved)));
        return saved;
    }

    private String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message content is not serializable", e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored message is not valid JSON", e);
        }
    }

    private static final class PendingAssistant {
        private final String         text;
        private final List<ToolCall> calls = new ArrayList<>();

        private PendingAssistant(String text) {
            this.text = text;
        }
    }
}
