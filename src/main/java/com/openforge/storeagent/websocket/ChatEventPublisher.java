package com.openforge.storeagent.websocket;

import com.openforge.storeagent.agent.event.ChatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Component;

/**
 * Routes ChatEvents to the STOMP topic of their session:
 *
 *   /topic/chat/{sessionId}
 *
 * Delivery is best effort; a failed send is logged and the turn goes on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/chat/";

    private final SimpMessageSendingOperations messagingTemplate;

    public void publish(ChatEvent event) {
        String destination = TOPIC_PREFIX + event.sessionId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (MessagingException e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
