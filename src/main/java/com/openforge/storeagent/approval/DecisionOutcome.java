package com.openforge.storeagent.approval;

/** What an inbound decision callback did to its action. */
public enum DecisionOutcome {

    /** The action moved to approved or rejected. */
    APPLIED,

    /** The action was already resolved; duplicate or late delivery. */
    IGNORED,

    /** The TTL had passed; the action is (now) expired. */
    EXPIRED
}
