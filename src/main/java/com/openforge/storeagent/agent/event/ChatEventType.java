package com.openforge.storeagent.agent.event;

/**
 * Classifies every event streamed to /topic/chat/{sessionId}.
 */
public enum ChatEventType {

    /** The turn moved to a new state. content = TurnState name. */
    TURN_STATE,

    /** A message was appended. payload = MessageResponse. */
    MESSAGE,

    /** A write was queued for approval. payload = pending action summary. */
    APPROVAL_REQUESTED,

    /** A queued write was decided, executed, failed or expired. */
    ACTION_RESOLVED,

    /** The turn ended with an error. content = message. */
    ERROR
}
