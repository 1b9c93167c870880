package com.openforge.storeagent.agent;

import java.util.List;
import java.util.UUID;

/**
 * How a turn (or a resumed turn) ended.
 *
 * @param reply            final assistant text, or the error shown to the admin
 * @param pendingActionIds writes queued by this turn, for AWAITING_APPROVAL
 */
public record TurnResult(Long sessionId, Outcome outcome, String reply, List<UUID> pendingActionIds) {

    public enum Outcome {
        COMPLETED,
        AWAITING_APPROVAL,
        FAILED,
        /** A resume that found nothing left to do. */
        NO_OP
    }

    public static TurnResult completed(Long sessionId, String reply) {
        return new TurnResult(sessionId, Outcome.COMPLETED, reply, List.of());
    }

    public static TurnResult awaitingApproval(Long sessionId, List<UUID> actionIds) {
        return new TurnResult(sessionId, Outcome.AWAITING_APPROVAL, null, List.copyOf(actionIds));
    }

    public static TurnResult failed(Long sessionId, String message) {
        return new TurnResult(sessionId, Outcome.FAILED, message, List.of());
    }

    public static TurnResult noOp(Long sessionId) {
        return new TurnResult(sessionId, Outcome.NO_OP, null, List.of());
    }
}
