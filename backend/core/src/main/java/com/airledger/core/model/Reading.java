package com.airledger.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One station observation. Pollutant values and meteorological fields are optional; the timestamp is
 * always an absolute instant.
 */
public record Reading(
        String stationId,
        Instant timestamp,
        Map<Pollutant, Double> pollutants,
        MetContext met,
        SourceMetadata source
) {
    public Reading {
        Map<Pollutant, Double> copy = new EnumMap<>(Pollutant.class);
        if (pollutants != null) {
            pollutants.forEach((pollutant, value) -> {
                if (pollutant != null && value != null) {
                    copy.put(pollutant, value);
                }
            });
        }
        pollutants = Collections.unmodifiableMap(copy);
        met = met == null ? MetContext.EMPTY : met;
    }

    /**
     * Builds a reading from a timestamp without zone information, which is taken to be UTC.
     */
    public static Reading atUtc(
            String stationId,
            LocalDateTime naiveTimestamp,
            Map<Pollutant, Double> pollutants,
            MetContext met,
            SourceMetadata source
    ) {
        Instant timestamp = naiveTimestamp == null ? null : naiveTimestamp.toInstant(ZoneOffset.UTC);
        return new Reading(stationId, timestamp, pollutants, met, source);
    }

    public Optional<Double> value(Pollutant pollutant) {
        return Optional.ofNullable(pollutants.get(pollutant));
    }

    public boolean hasAnyPollutant() {
        return !pollutants.isEmpty();
    }

    public Reading withMet(MetContext replacement) {
        return new Reading(stationId, timestamp, pollutants, replacement, source);
    }
}
