package com.airledger.core.model;

import java.time.Instant;

/**
 * A classification event as held by the persistence layer, with its identity and review status.
 */
public record ComplianceRecord(
        String id,
        ClassificationEvent event,
        EventStatus status,
        Instant createdAt
) {
    public ComplianceRecord withStatus(EventStatus next) {
        return new ComplianceRecord(id, event, next, createdAt);
    }

    public String stationId() {
        return event.stationId();
    }

    public Pollutant pollutant() {
        return event.pollutant();
    }

    public Tier tier() {
        return event.tier();
    }
}
