package com.openforge.storeagent.approval;

public enum Decision {
    APPROVE,
    REJECT
}
