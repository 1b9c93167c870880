package com.openforge.storeagent.agent;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(Long sessionId) {
        super("Chat session not found: " + sessionId);
    }
}
