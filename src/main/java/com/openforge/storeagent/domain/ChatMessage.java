package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One immutable entry of a conversation. Ordering within a session is by id.
 *
 * content shapes (JSON):
 *   USER            {"text": "..."}
 *   ASSISTANT       {"text": "..."}
 *   TOOL_INVOCATION {"id", "name", "input", "requires_approval", "pending_action_id"?, "route"?}
 *   TOOL_RESULT     {"tool_use_id", "content", "is_error", "pending_action_id"?, "awaiting_approval"?}
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_messages",
    indexes = @Index(name = "idx_chat_message_session", columnList = "session_id, id")
)
public class ChatMessage extends BaseEntity {

    public enum Role {
        USER,
        ASSISTANT,
        TOOL_INVOCATION,
        TOOL_RESULT
    }

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 32)
    private Role role;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    /** Token counts, latency and optionally the raw request/response of the call that produced it. */
    @Column(name = "api_interaction", columnDefinition = "TEXT")
    private String apiInteraction;
}
