package com.airledger.service.store;

import com.airledger.core.model.AveragingPeriod;
import com.airledger.core.model.ClassificationEvent;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.EventStatus;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.RuleResult;
import com.airledger.core.model.Tier;
import com.airledger.core.model.WindowHorizon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileComplianceEventStoreTest {
    private static final Instant NOW = Instant.parse("2026-01-15T06:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void savedRecordsSurviveReload() {
        Path file = tempDir.resolve("data/compliance-events.json");
        JsonFileComplianceEventStore store = new JsonFileComplianceEventStore(file);
        ComplianceRecord record = violation("evt-1", NOW);
        store.save(record);

        JsonFileComplianceEventStore reloaded = new JsonFileComplianceEventStore(file);

        assertEquals(record, reloaded.find("evt-1").orElseThrow());
        assertEquals(1, reloaded.all().size());
    }

    @Test
    void statusUpdatesArePersisted() throws Exception {
        Path file = tempDir.resolve("compliance-events.json");
        JsonFileComplianceEventStore store = new JsonFileComplianceEventStore(file);
        store.save(violation("evt-1", NOW));

        ComplianceRecord updated = store.updateStatus("evt-1", EventStatus.ESCALATED);

        assertEquals(EventStatus.ESCALATED, updated.status());
        assertEquals(EventStatus.ESCALATED, new JsonFileComplianceEventStore(file).find("evt-1").orElseThrow().status());
        assertTrue(Files.readString(file).contains("\"ESCALATED\""));
    }

    @Test
    void overlapLookupSkipsResolvedRecordsAfterReload() {
        Path file = tempDir.resolve("compliance-events.json");
        JsonFileComplianceEventStore store = new JsonFileComplianceEventStore(file);
        store.save(violation("evt-1", NOW));
        store.save(violation("evt-2", NOW.plus(Duration.ofMinutes(30))));
        store.updateStatus("evt-2", EventStatus.DISMISSED);

        JsonFileComplianceEventStore reloaded = new JsonFileComplianceEventStore(file);

        assertEquals("evt-1", reloaded.findOpenOverlapping("DL001", Pollutant.PM25, Tier.VIOLATION,
                NOW.minus(Duration.ofHours(2))).orElseThrow().id());
        assertTrue(reloaded.hasViolationBetween("DL001", Pollutant.PM25, NOW.minusSeconds(1), NOW.plusSeconds(1)));
    }

    @Test
    void rejectsDuplicateIdsAndUnknownUpdates() {
        JsonFileComplianceEventStore store = new JsonFileComplianceEventStore(tempDir.resolve("compliance-events.json"));
        store.save(violation("evt-1", NOW));

        assertThrows(IllegalStateException.class, () -> store.save(violation("evt-1", NOW)));
        IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
                () -> store.updateStatus("evt-9", EventStatus.RESOLVED));
        assertTrue(missing.getMessage().contains("evt-9"));
    }

    @Test
    void corruptFileFailsOnLoad() throws Exception {
        Path file = tempDir.resolve("compliance-events.json");
        Files.writeString(file, "{not-a-list");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new JsonFileComplianceEventStore(file));
        assertTrue(ex.getMessage().contains("compliance-events.json"));
    }

    private static ComplianceRecord violation(String id, Instant windowEnd) {
        RuleResult rule = new RuleResult(Pollutant.PM25, AveragingPeriod.TWENTY_FOUR_HOURS, 80.0, 60.0, false, 20.0,
                33.33, "NAAQS PM2.5 24hr limit (60.0 μg/m³)", "CPCB NAAQS 2009", "CPCB NAAQS 2009");
        ClassificationEvent event = new ClassificationEvent("DL001", Pollutant.PM25, Tier.VIOLATION,
                EventStatus.PENDING_OFFICER_REVIEW, rule, WindowHorizon.TWENTY_FOUR_HOURS,
                windowEnd.minus(Duration.ofHours(24)), windowEnd, new MetContext(12.0, 88.0, null, null, null, null, true),
                false);
        return new ComplianceRecord(id, event, EventStatus.PENDING_OFFICER_REVIEW, windowEnd);
    }
}
