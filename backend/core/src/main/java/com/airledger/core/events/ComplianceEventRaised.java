package com.airledger.core.events;

import java.time.Instant;

public record ComplianceEventRaised(
        Instant timestamp,
        String eventId,
        String stationId,
        String pollutant,
        String tier,
        String status,
        int windowHours,
        double observedValue,
        double limitValue,
        String origin,
        boolean persisted
) implements Event {
    @Override
    public String type() {
        return "ComplianceEventRaised";
    }
}
