package com.airledger.core.model;

import java.time.Instant;

/**
 * Average of the readings that fall inside one horizon as of a given instant. Recomputed, never mutated.
 */
public record WindowResult(
        String stationId,
        Pollutant pollutant,
        WindowHorizon horizon,
        double averageValue,
        int readingCount,
        Instant windowStart,
        Instant windowEnd,
        MetContext met
) {
    public String label() {
        return horizon.period().label();
    }
}
