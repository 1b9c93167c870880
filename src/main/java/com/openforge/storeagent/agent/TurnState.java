package com.openforge.storeagent.agent;

/**
 * Where a turn currently is.
 *
 *   AWAITING_COMPLETION ─► EMITTING_TEXT
 *          │
 *          └─► REQUESTING_TOOL ─► EXECUTING_READ ─► (back to AWAITING_COMPLETION)
 *                     └─────────► QUEUED_FOR_APPROVAL
 */
public enum TurnState {
    AWAITING_COMPLETION,
    REQUESTING_TOOL,
    EXECUTING_READ,
    QUEUED_FOR_APPROVAL,
    EMITTING_TEXT,
    FAILED
}
