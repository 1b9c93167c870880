package com.openforge.storeagent.action;

import com.openforge.storeagent.domain.PendingAction.ActionStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID         actionId;
    private final ActionStatus current;
    private final ActionStatus attempted;

    public InvalidTransitionException(UUID actionId, ActionStatus current, ActionStatus attempted) {
        super("Action %s cannot move from %s to %s".formatted(actionId, current, attempted));
        this.actionId  = actionId;
        this.current   = current;
        this.attempted = attempted;
    }
}
