package com.airledger.collectors.compliance;

import com.airledger.core.model.EventStatus;

import java.util.Locale;

public enum OfficerAction {
    ESCALATE(EventStatus.ESCALATED),
    DISMISS(EventStatus.DISMISSED),
    FLAG_FOR_MONITORING(EventStatus.FLAG),
    RESOLVE(EventStatus.RESOLVED);

    private final EventStatus resultingStatus;

    OfficerAction(EventStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public EventStatus resultingStatus() {
        return resultingStatus;
    }

    public static OfficerAction parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("action_type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action_type: " + value, e);
        }
    }
}
