package com.airledger.core.events;

import java.time.Instant;

public record OfficerActionRecorded(
        Instant timestamp,
        String complianceEventId,
        String actionType,
        String officerId,
        String resultingStatus
) implements Event {
    @Override
    public String type() {
        return "OfficerActionRecorded";
    }
}
