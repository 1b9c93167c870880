package com.openforge.storeagent.agent.dto;

import com.openforge.storeagent.domain.ChatSession;
import com.openforge.storeagent.websocket.ChatEventPublisher;

import java.time.LocalDateTime;

/**
 * Includes the STOMP topic so the client can subscribe before posting the
 * first message.
 */
public record SessionResponse(
        Long          id,
        Long          ownerId,
        String        title,
        String        wsSubscribePath,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static SessionResponse from(ChatSession session) {
        return new SessionResponse(
                session.getId(),
                session.getOwnerId(),
                session.getTitle(),
                ChatEventPublisher.TOPIC_PREFIX + session.getId(),
                session.getCreateTime(),
                session.getUpdateTime());
    }
}
