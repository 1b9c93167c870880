package com.openforge.storeagent.action;

import java.util.UUID;

public class ActionNotFoundException extends RuntimeException {

    public ActionNotFoundException(UUID actionId) {
        super("No pending action with id " + actionId);
    }
}
