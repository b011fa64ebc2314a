package com.airledger.collectors.api;

import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.EventStatus;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Tier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ComplianceEventStore {
    void save(ComplianceRecord record);

    Optional<ComplianceRecord> find(String id);

    ComplianceRecord updateStatus(String id, EventStatus status);

    List<ComplianceRecord> all();

    /**
     * An unresolved event for the same station, pollutant and tier whose window ends at or after
     * {@code windowEndFloor}.
     */
    default Optional<ComplianceRecord> findOpenOverlapping(String stationId, Pollutant pollutant, Tier tier, Instant windowEndFloor) {
        return all().stream()
                .filter(record -> record.stationId().equals(stationId))
                .filter(record -> record.pollutant() == pollutant)
                .filter(record -> record.tier() == tier)
                .filter(record -> !record.status().isResolved())
                .filter(record -> !record.event().windowEnd().isBefore(windowEndFloor))
                .findFirst();
    }

    /**
     * Whether a VIOLATION for the station and pollutant was created in {@code [from, to)}.
     */
    default boolean hasViolationBetween(String stationId, Pollutant pollutant, Instant from, Instant to) {
        return all().stream()
                .filter(record -> record.stationId().equals(stationId))
                .filter(record -> record.pollutant() == pollutant)
                .filter(record -> record.tier() == Tier.VIOLATION)
                .anyMatch(record -> !record.createdAt().isBefore(from) && record.createdAt().isBefore(to));
    }
}
