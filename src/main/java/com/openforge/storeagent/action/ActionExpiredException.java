package com.openforge.storeagent.action;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A decision arrived after the action's TTL, whether or not the sweep has
 * already marked the row expired.
 */
@Getter
public class ActionExpiredException extends RuntimeException {

    private final UUID    actionId;
    private final Instant expiresAt;

    public ActionExpiredException(UUID actionId, Instant expiresAt) {
        super("Action " + actionId + " expired at " + expiresAt + " and can no longer be decided");
        this.actionId  = actionId;
        this.expiresAt = expiresAt;
    }
}
