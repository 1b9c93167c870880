package com.openforge.storeagent.approval;

import com.openforge.storeagent.domain.PendingAction.ActionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Channel-neutral content of an approval card.
 *
 * @param parameters pretty-printed tool input, already truncated for display
 * @param actor      who approved or rejected; null while pending
 * @param detail     result summary or error text once the action finished
 */
public record ApprovalCard(
        UUID         actionId,
        String       toolName,
        String       domain,
        String       parameters,
        Long         requesterId,
        ActionStatus status,
        String       actor,
        String       detail,
        Instant      expiresAt
) {

    public boolean awaitingDecision() {
        return status == ActionStatus.PENDING;
    }

    public String title() {
        return switch (status) {
            case PENDING  -> "AI Action Request";
            case APPROVED -> "Action Approved";
            case EXECUTED -> "Action Executed";
            case REJECTED -> "Action Rejected";
            case FAILED   -> "Action Failed";
            case EXPIRED  -> "Action Expired";
        };
    }

    /** One-line plain text summary, used as notification fallback text. */
    public String summary() {
        return "%s: %s (action %s)".formatted(title(), toolName, actionId);
    }
}
