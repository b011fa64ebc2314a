package com.airledger.core.model;

public enum EventStatus {
    MONITOR,
    FLAG,
    PENDING_OFFICER_REVIEW,
    ESCALATED,
    DISMISSED,
    RESOLVED;

    public boolean isResolved() {
        return this == DISMISSED || this == RESOLVED;
    }
}
