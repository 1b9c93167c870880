package com.openforge.storeagent.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A mutating tool call waiting for (or resolved by) a human decision.
 *
 * Status graph:
 *
 *   PENDING ──► APPROVED ──► EXECUTED
 *      │            └──────► FAILED
 *      ├──────► REJECTED
 *      └──────► EXPIRED
 *
 * Rows are only moved through conditional updates in
 * {@code PendingActionRepository}; the entity itself is never saved after
 * creation. resolved_at is set by the first transition out of PENDING.
 * execution_started_at is claimed once, right before an approved call runs,
 * so a recovered action is never executed twice.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "pending_actions",
    uniqueConstraints = @UniqueConstraint(name = "uq_pending_action_ref", columnNames = "external_ref"),
    indexes = {
        @Index(name = "idx_pending_action_session", columnList = "session_id"),
        @Index(name = "idx_pending_action_status_expiry", columnList = "status, expires_at")
    }
)
public class PendingAction {

    public enum ActionStatus {
        PENDING,
        APPROVED,
        REJECTED,
        EXECUTED,
        FAILED,
        EXPIRED;

        private static final Set<ActionStatus> TERMINAL = Set.of(REJECTED, EXECUTED, FAILED, EXPIRED);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }
    }

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    /** The tool_invocation message that spawned this action. */
    @Column(name = "message_id")
    private Long messageId;

    @Column(name = "requester_id", nullable = false)
    private Long requesterId;

    @Column(name = "tool_name", nullable = false, length = 128)
    private String toolName;

    @Column(name = "tool_input", nullable = false, columnDefinition = "TEXT")
    private String toolInput;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ActionStatus status = ActionStatus.PENDING;

    /** Notification message id, e.g. "C0123:1712345678.000100" for Slack. */
    @Column(name = "external_ref", length = 128)
    private String externalRef;

    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "approved_by", length = 128)
    private String approvedBy;

    @Column(name = "rejected_by", length = 128)
    private String rejectedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "execution_started_at")
    private Instant executionStartedAt;
}
