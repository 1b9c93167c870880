package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One admin conversation. Messages, metrics and pending actions point back
 * to it by id; the whole state of a conversation lives in those rows.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "chat_sessions",
    indexes = @Index(name = "idx_chat_session_owner", columnList = "owner_id")
)
public class ChatSession extends BaseEntity {

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "title", length = 255)
    private String title;
}
