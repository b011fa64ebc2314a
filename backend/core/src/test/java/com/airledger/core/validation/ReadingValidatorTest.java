package com.airledger.core.validation;

import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.SourceMetadata;
import com.airledger.core.model.ValidationResult;
import com.airledger.core.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

import static com.airledger.core.support.TestReadings.reading;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadingValidatorTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ReadingValidator validator = new ReadingValidator(new MutableClock(NOW));

    @ParameterizedTest
    @EnumSource(Pollutant.class)
    void valueExactlyAtUpperBoundIsAcceptedAndOneBeyondIsRejected(Pollutant pollutant) {
        double max = PhysicalBounds.forPollutant(pollutant).max();

        assertTrue(validator.validate(reading("DL001", NOW, pollutant, max)).valid());
        ValidationResult beyond = validator.validate(reading("DL001", NOW, pollutant, max + 1));
        assertFalse(beyond.valid());
        assertTrue(beyond.reasons().get(0).contains("exceeds physical maximum"));
    }

    @ParameterizedTest
    @EnumSource(Pollutant.class)
    void valueAtLowerBoundIsAcceptedAndBelowIsRejected(Pollutant pollutant) {
        assertTrue(validator.validate(reading("DL001", NOW, pollutant, 0.0)).valid());
        assertFalse(validator.validate(reading("DL001", NOW, pollutant, -1.0)).valid());
    }

    @Test
    void collectsEveryReason() {
        Reading bad = new Reading(
                " ",
                NOW.minus(Duration.ofHours(3)),
                Map.of(Pollutant.PM25, 1500.0),
                new MetContext(null, 120.0, null, null, 700.0, null, null),
                SourceMetadata.of("test")
        );

        ValidationResult result = validator.validate(bad);

        assertFalse(result.valid());
        assertEquals(5, result.reasons().size(), result.reasons().toString());
        assertEquals("Missing required field: station_id", result.reasons().get(0));
    }

    @Test
    void missingTimestampAndNoPollutantsAreRejected() {
        Reading empty = new Reading("DL001", null, Map.of(), null, SourceMetadata.of("test"));

        ValidationResult result = validator.validate(empty);

        assertTrue(result.reasons().contains("Missing required field: timestamp"));
        assertTrue(result.reasons().contains("No pollutant values present in reading"));
    }

    @Test
    void freshnessWindowAllowsTwoHoursOldAndFiveMinutesAhead() {
        assertTrue(validator.validate(reading("DL001", NOW.minus(Duration.ofHours(2)), Pollutant.PM10, 50)).valid());
        assertFalse(validator.validate(reading("DL001", NOW.minus(Duration.ofHours(2)).minusSeconds(1), Pollutant.PM10, 50)).valid());
        assertTrue(validator.validate(reading("DL001", NOW.plus(Duration.ofMinutes(5)), Pollutant.PM10, 50)).valid());
        assertFalse(validator.validate(reading("DL001", NOW.plus(Duration.ofMinutes(6)), Pollutant.PM10, 50)).valid());
    }

    @Test
    void naiveTimestampIsTreatedAsUtc() {
        Reading naive = Reading.atUtc(
                "DL001",
                LocalDateTime.of(2026, 3, 1, 11, 30),
                Map.of(Pollutant.NO2, 40.0),
                null,
                SourceMetadata.of("test")
        );

        assertEquals(Instant.parse("2026-03-01T11:30:00Z"), naive.timestamp());
        assertTrue(validator.validate(naive).valid());
    }

    @Test
    void meteorologicalBoundsAreInclusive() {
        MetContext edges = new MetContext(60.0, 100.0, 100.0, 360.0, 800.0, null, null);
        Reading atEdges = new Reading("DL001", NOW, Map.of(Pollutant.O3, 10.0), edges, SourceMetadata.of("test"));
        assertTrue(validator.validate(atEdges).valid());

        MetContext windy = new MetContext(null, null, null, 361.0, null, null, null);
        Reading beyond = new Reading("DL001", NOW, Map.of(Pollutant.O3, 10.0), windy, SourceMetadata.of("test"));
        assertEquals(1, validator.validate(beyond).reasons().size());
    }

    @Test
    void nonNumericValueIsRejected() {
        ValidationResult result = validator.validate(reading("DL001", NOW, Pollutant.SO2, Double.NaN));

        assertFalse(result.valid());
        assertTrue(result.reasons().get(0).contains("must be numeric"));
    }
}
