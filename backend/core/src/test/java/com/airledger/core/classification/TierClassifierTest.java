package com.airledger.core.classification;

import com.airledger.core.model.ClassificationEvent;
import com.airledger.core.model.EventStatus;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Tier;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;
import com.airledger.core.rules.RuleEngine;
import com.airledger.core.support.MutableClock;
import com.airledger.core.support.TestReadings;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TierClassifierTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final TierClassifier classifier = new TierClassifier(
            new RuleEngine(TestReadings.cpcbLimits()),
            new ZoneAdjustments(Map.of("roadside", 0.9, "residential", 1.0, "industrial", 1.0)),
            new MutableClock(NOW)
    );

    @Test
    void pm25AboveDailyLimitIsExactlyOneViolation() {
        List<ClassificationEvent> events = classifier.classify("DL001", Pollutant.PM25,
                windows(Pollutant.PM25, 90.0, 80.0, 75.0), "residential", ConsecutiveBreachProbe.NONE);

        assertEquals(1, events.size());
        ClassificationEvent violation = events.get(0);
        assertEquals(Tier.VIOLATION, violation.tier());
        assertEquals(EventStatus.PENDING_OFFICER_REVIEW, violation.status());
        assertEquals(WindowHorizon.TWENTY_FOUR_HOURS, violation.horizon());
        assertEquals(75.0, violation.observedValue());
        assertEquals(60.0, violation.limitValue());
        assertEquals(25.0, violation.exceedancePercent());
        assertFalse(violation.consecutiveDayBreach());
    }

    @Test
    void flagAndViolationLogAtWarningWhileMonitorStaysAtInfo() {
        Logger logger = Logger.getLogger(TierClassifier.class.getName());
        List<LogRecord> records = new CopyOnWriteArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getMessage().startsWith("VIOLATION") || record.getMessage().startsWith("FLAG")
                        || record.getMessage().startsWith("MONITOR")) {
                    records.add(record);
                }
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            classifier.classify("DL002", Pollutant.O3,
                    windows(Pollutant.O3, 190.0, 110.0, 95.0), "residential", ConsecutiveBreachProbe.NONE);
            classifier.classify("DL001", Pollutant.PM25,
                    windows(Pollutant.PM25, 90.0, 80.0, 75.0), "residential", ConsecutiveBreachProbe.NONE);
        } finally {
            logger.removeHandler(handler);
        }

        Map<String, Level> levels = new HashMap<>();
        records.forEach(record -> levels.put(record.getMessage().substring(0, record.getMessage().indexOf(':')),
                record.getLevel()));
        assertEquals(Map.of("FLAG", Level.WARNING, "MONITOR", Level.INFO, "VIOLATION", Level.WARNING), levels);
    }

    @Test
    void ozoneCanRaiseMonitorAndFlagTogether() {
        List<ClassificationEvent> events = classifier.classify("DL002", Pollutant.O3,
                windows(Pollutant.O3, 190.0, 110.0, 95.0), "residential", ConsecutiveBreachProbe.NONE);

        assertEquals(List.of(Tier.FLAG, Tier.MONITOR), events.stream().map(ClassificationEvent::tier).toList());
        assertEquals(EventStatus.FLAG, events.get(0).status());
        assertEquals(EventStatus.MONITOR, events.get(1).status());
    }

    @Test
    void roadsideFactorTightensTheLimit() {
        List<WindowResult> windows = windows(Pollutant.PM25, 55.0, 55.0, 55.0);

        List<ClassificationEvent> roadside =
                classifier.classify("DL001", Pollutant.PM25, windows, "Roadside", ConsecutiveBreachProbe.NONE);
        List<ClassificationEvent> residential =
                classifier.classify("DL003", Pollutant.PM25, windows, "residential", ConsecutiveBreachProbe.NONE);

        assertEquals(1, roadside.size());
        assertEquals(Tier.VIOLATION, roadside.get(0).tier());
        assertEquals(61.1111, roadside.get(0).observedValue(), 1e-4);
        assertTrue(residential.isEmpty());
    }

    @Test
    void priorDayProbeMarksOnlyViolations() {
        List<String> probed = new ArrayList<>();
        ConsecutiveBreachProbe probe = (stationId, pollutant) -> {
            probed.add(stationId + ":" + pollutant.code());
            return true;
        };

        List<ClassificationEvent> events = classifier.classify("DL004", Pollutant.CO,
                windows(Pollutant.CO, 5.0, 3.0, 1.0), "industrial", probe);
        assertTrue(events.stream().noneMatch(ClassificationEvent::consecutiveDayBreach));
        assertTrue(probed.isEmpty());

        List<ClassificationEvent> daily = classifier.classify("DL004", Pollutant.NO2,
                windows(Pollutant.NO2, 20.0, 20.0, 95.0), "industrial", probe);
        assertEquals(1, daily.size());
        assertTrue(daily.get(0).consecutiveDayBreach());
        assertEquals(List.of("DL004:no2"), probed);
    }

    @Test
    void horizonsWithoutLimitAreSkipped() {
        List<ClassificationEvent> events = classifier.classify("DL001", Pollutant.PM10,
                windows(Pollutant.PM10, 900.0, 900.0, 99.0), "residential", ConsecutiveBreachProbe.NONE);

        assertTrue(events.isEmpty());
    }

    @Test
    void metOverrideReplacesWindowContext() {
        MetContext streaming = new MetContext(12.0, 90.0, 0.5, null, null, null, Boolean.TRUE);

        List<ClassificationEvent> events = classifier.classify("DL001", Pollutant.PM25,
                windows(Pollutant.PM25, 10.0, 10.0, 70.0), "residential", ConsecutiveBreachProbe.NONE, streaming);

        assertSame(streaming, events.get(0).met());
    }

    @Test
    void allPollutantsAreGatheredIntoOneResult() {
        ClassificationResult result = classifier.classifyAllPollutants("DL001", Map.of(
                Pollutant.PM25, windows(Pollutant.PM25, 10.0, 10.0, 70.0),
                Pollutant.O3, windows(Pollutant.O3, 200.0, 120.0, 50.0),
                Pollutant.SO2, windows(Pollutant.SO2, 5.0, 5.0, 5.0)
        ), "residential", ConsecutiveBreachProbe.NONE);

        assertEquals(3, result.events().size());
        assertTrue(result.hasViolation());
        assertTrue(result.hasFlag());
        assertEquals(1, result.count(Tier.MONITOR));
        assertEquals(NOW, result.timestamp());
    }

    private static List<WindowResult> windows(Pollutant pollutant, double oneHour, double eightHours, double day) {
        return List.of(
                window(pollutant, WindowHorizon.ONE_HOUR, oneHour),
                window(pollutant, WindowHorizon.EIGHT_HOURS, eightHours),
                window(pollutant, WindowHorizon.TWENTY_FOUR_HOURS, day)
        );
    }

    private static WindowResult window(Pollutant pollutant, WindowHorizon horizon, double average) {
        return new WindowResult("DL001", pollutant, horizon, average, 4,
                NOW.minus(horizon.duration()).plusSeconds(1), NOW, MetContext.EMPTY);
    }
}
