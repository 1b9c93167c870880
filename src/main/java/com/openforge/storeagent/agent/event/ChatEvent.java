package com.openforge.storeagent.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.storeagent.agent.TurnState;

import java.util.UUID;

/**
 * Envelope for everything pushed over WebSocket for one chat session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(
        Long          sessionId,
        ChatEventType type,
        String        content,
        Object        payload,
        long          timestamp
) {

    public static ChatEvent turnState(Long sessionId, TurnState state) {
        return new ChatEvent(sessionId, ChatEventType.TURN_STATE, state.name(), null, now());
    }

    public static ChatEvent message(Long sessionId, Object message) {
        return new ChatEvent(sessionId, ChatEventType.MESSAGE, null, message, now());
    }

    public static ChatEvent approvalRequested(Long sessionId, UUID actionId, String toolName) {
        return new ChatEvent(sessionId, ChatEventType.APPROVAL_REQUESTED, toolName,
                new ActionPayload(actionId, toolName, "pending"), now());
    }

    public static ChatEvent actionResolved(Long sessionId, UUID actionId, String toolName, String status) {
        return new ChatEvent(sessionId, ChatEventType.ACTION_RESOLVED, status,
                new ActionPayload(actionId, toolName, status), now());
    }

    public static ChatEvent error(Long sessionId, String message) {
        return new ChatEvent(sessionId, ChatEventType.ERROR, message, null, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    public record ActionPayload(UUID actionId, String toolName, String status) {}
}
