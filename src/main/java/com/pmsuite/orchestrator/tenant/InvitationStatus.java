package com.pmsuite.orchestrator.tenant;

public enum InvitationStatus {

    PENDING,
    ACCEPTED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
