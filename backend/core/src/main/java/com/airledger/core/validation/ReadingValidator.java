package com.airledger.core.validation;

import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.ValidationResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Rejects readings that are structurally incomplete, physically implausible or outside the accepted
 * freshness window. All violations are collected; nothing is thrown.
 */
public final class ReadingValidator {
    private static final Logger LOGGER = Logger.getLogger(ReadingValidator.class.getName());

    public static final Duration MAX_AGE = Duration.ofHours(2);
    public static final Duration MAX_FUTURE_SKEW = Duration.ofMinutes(5);

    private final Clock clock;

    public ReadingValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validate(Reading reading) {
        List<String> reasons = new ArrayList<>();

        if (reading.stationId() == null || reading.stationId().isBlank()) {
            reasons.add("Missing required field: station_id");
        }
        if (reading.timestamp() == null) {
            reasons.add("Missing required field: timestamp");
        }
        if (!reading.hasAnyPollutant()) {
            reasons.add("No pollutant values present in reading");
        }

        Instant timestamp = reading.timestamp();
        if (timestamp != null) {
            Instant now = clock.instant();
            Duration age = Duration.between(timestamp, now);
            if (age.compareTo(MAX_AGE) > 0) {
                reasons.add("Timestamp too old: " + age + " (max " + MAX_AGE.toHours() + "h)");
            }
            if (age.negated().compareTo(MAX_FUTURE_SKEW) > 0) {
                reasons.add("Timestamp is in the future: " + timestamp);
            }
        }

        for (Map.Entry<Pollutant, Double> entry : reading.pollutants().entrySet()) {
            checkBounds(entry.getKey().code(), entry.getValue(), PhysicalBounds.forPollutant(entry.getKey()), reasons);
        }
        PhysicalBounds.metFields().forEach((name, field) ->
                checkBounds(name, field.accessor().apply(reading.met()), field.range(), reasons));

        if (reasons.isEmpty()) {
            return ValidationResult.ok();
        }
        LOGGER.warning("Validation failed for station " + reading.stationId() + ": " + reasons);
        return ValidationResult.invalid(reasons);
    }

    private static void checkBounds(String field, Double value, PhysicalBounds.Range range, List<String> reasons) {
        if (value == null) {
            return;
        }
        if (value.isNaN() || value.isInfinite()) {
            reasons.add(field + " must be numeric, got " + value);
            return;
        }
        if (value < range.min()) {
            reasons.add(field + "=" + value + " below physical minimum " + range.min());
        }
        if (value > range.max()) {
            reasons.add(field + "=" + value + " exceeds physical maximum " + range.max());
        }
    }
}
