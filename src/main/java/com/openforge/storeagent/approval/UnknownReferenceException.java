package com.openforge.storeagent.approval;

public class UnknownReferenceException extends RuntimeException {

    public UnknownReferenceException(String externalRef) {
        super("No pending action is correlated with external ref " + externalRef);
    }
}
