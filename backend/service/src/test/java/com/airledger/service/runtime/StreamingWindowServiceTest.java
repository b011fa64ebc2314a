package com.airledger.service.runtime;

import com.airledger.collectors.compliance.ClassificationPipeline;
import com.airledger.collectors.compliance.Origin;
import com.airledger.core.bus.EventBus;
import com.airledger.core.events.ComplianceEventRaised;
import com.airledger.core.ledger.InMemoryLedgerStore;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.SourceMetadata;
import com.airledger.core.model.StationConfig;
import com.airledger.core.model.Tier;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;
import com.airledger.core.window.RollingWindowEngine;
import com.airledger.service.store.JsonFileComplianceEventStore;
import com.airledger.service.support.MutableClock;
import com.airledger.service.support.TestPipelines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamingWindowServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-15T06:00:00Z");
    private static final StationConfig DL003 = new StationConfig(
            "DL003", "R K Puram", null, "residential", 28.56, 77.18, List.of());

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(NOW);
    private final EventBus bus = new EventBus();
    private final List<ComplianceEventRaised> raised = new CopyOnWriteArrayList<>();
    private final RollingWindowEngine engine = new RollingWindowEngine();
    private final InMemoryLedgerStore ledger = new InMemoryLedgerStore();
    private JsonFileComplianceEventStore events;
    private ClassificationPipeline pipeline;
    private StreamingWindowService streaming;

    @BeforeEach
    void setUp() {
        bus.subscribe(ComplianceEventRaised.class, raised::add);
        events = new JsonFileComplianceEventStore(tempDir.resolve("compliance-events.json"));
        pipeline = TestPipelines.pipeline(events, ledger, bus, clock);
        streaming = new StreamingWindowService(engine, pipeline, Map.of(DL003.stationId(), DL003));
        streaming.start();
    }

    @AfterEach
    void tearDown() {
        streaming.stop();
    }

    @Test
    void pushedExceedanceIsPersistedWhenNoPollingIsRunning() throws Exception {
        streaming.push(pm25("DL003", NOW, 75.0));

        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(1, streaming.processedCount());
        List<ComplianceRecord> stored = events.all();
        assertEquals(1, stored.size());
        assertEquals(Tier.VIOLATION, stored.get(0).tier());
        assertEquals(1, ledger.size());
        assertEquals("STREAMING", raised.get(0).origin());
        assertTrue(raised.get(0).persisted());
    }

    @Test
    void streamingIsAdvisoryWhilePollingIsFresh() throws Exception {
        WindowResult calm = new WindowResult("DL003", Pollutant.PM25, WindowHorizon.TWENTY_FOUR_HOURS, 30.0, 1,
                NOW.minus(Duration.ofHours(24)), NOW, MetContext.EMPTY);
        pipeline.evaluate(Origin.POLLING, DL003, Pollutant.PM25, List.of(calm), null);

        clock.advance(Duration.ofMinutes(1));
        streaming.push(pm25("DL003", clock.instant(), 75.0));
        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));

        assertTrue(events.all().isEmpty());
        assertEquals(0, ledger.size());
        assertEquals(1, raised.size());
        assertFalse(raised.get(0).persisted());
        assertNull(raised.get(0).eventId());
    }

    @Test
    void runningMeanAccumulatesAcrossPushes() throws Exception {
        streaming.push(pm25("DL003", NOW.minus(Duration.ofHours(2)), 40.0));
        streaming.push(pm25("DL003", NOW.minus(Duration.ofHours(1)), 50.0));
        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(events.all().isEmpty());

        streaming.push(pm25("DL003", NOW, 120.0));
        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(3, streaming.processedCount());
        assertEquals(70.0, events.all().get(0).event().observedValue());
    }

    @Test
    void unknownStationsAreIgnored() throws Exception {
        streaming.push(pm25("XX999", NOW, 500.0));

        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));

        assertEquals(0, streaming.processedCount());
        assertTrue(events.all().isEmpty());
    }

    @Test
    void offlineStationKeepsItsBuffers() throws Exception {
        streaming.push(pm25("DL003", NOW, 45.0));
        assertTrue(streaming.awaitIdle(Duration.ofSeconds(5)));

        streaming.stationOffline("DL003");

        assertTrue(engine.isOffline("DL003"));
        assertFalse(engine.currentAverages("DL003", Pollutant.PM25, NOW).isEmpty());
    }

    private static Reading pm25(String stationId, Instant at, double value) {
        return new Reading(stationId, at, Map.of(Pollutant.PM25, value), null, SourceMetadata.of("mock"));
    }
}
