package com.airledger.collectors.compliance;

import com.airledger.collectors.api.ComplianceEventStore;
import com.airledger.core.bus.EventBus;
import com.airledger.core.classification.ConsecutiveBreachProbe;
import com.airledger.core.classification.TierClassifier;
import com.airledger.core.events.ComplianceEventRaised;
import com.airledger.core.events.LedgerEntryAppended;
import com.airledger.core.ledger.LedgerEventTypes;
import com.airledger.core.ledger.LedgerWriter;
import com.airledger.core.model.ClassificationEvent;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.LedgerEntry;
import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.RuleResult;
import com.airledger.core.model.StationConfig;
import com.airledger.core.model.Tier;
import com.airledger.core.model.WindowResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single entry point from window results to persisted compliance events. Both execution contexts call
 * {@link #evaluate}; runs for the same station and pollutant are serialized. The polling context is
 * authoritative: a streaming result is only persisted while polling has not evaluated the key within
 * twice the polling interval, otherwise it is published as advisory.
 */
public final class ClassificationPipeline {
    private static final Logger LOGGER = Logger.getLogger(ClassificationPipeline.class.getName());

    public static final Duration DEDUP_HORIZON = Duration.ofHours(2);
    static final Duration PRIOR_DAY_START = Duration.ofHours(48);
    static final Duration PRIOR_DAY_END = Duration.ofHours(1);

    private final TierClassifier classifier;
    private final ComplianceEventStore eventStore;
    private final LedgerWriter ledgerWriter;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration pollingStaleAfter;
    private final Map<Key, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Key, Instant> lastPolled = new ConcurrentHashMap<>();

    public ClassificationPipeline(
            TierClassifier classifier,
            ComplianceEventStore eventStore,
            LedgerWriter ledgerWriter,
            EventBus eventBus,
            Clock clock,
            Duration pollInterval
    ) {
        this.classifier = classifier;
        this.eventStore = eventStore;
        this.ledgerWriter = ledgerWriter;
        this.eventBus = eventBus;
        this.clock = clock;
        this.pollingStaleAfter = pollInterval.multipliedBy(2);
    }

    /**
     * Classifies one pollutant's window results and persists every new, non-duplicate event together
     * with its ledger entry.
     *
     * @param met annotation attached to the events instead of the window aggregate, or null
     * @return the records persisted by this call
     * @throws com.airledger.core.ledger.LedgerWriteException when the ledger cannot be written
     */
    public List<ComplianceRecord> evaluate(
            Origin origin,
            StationConfig station,
            Pollutant pollutant,
            List<WindowResult> windows,
            MetContext met
    ) {
        if (windows.isEmpty()) {
            return List.of();
        }
        Key key = new Key(station.stationId(), pollutant);
        ReentrantLock lock = locks.computeIfAbsent(key, ignored -> new ReentrantLock());
        lock.lock();
        try {
            Instant now = clock.instant();
            boolean advisory = origin == Origin.STREAMING && pollingFresh(key, now);
            if (origin == Origin.POLLING) {
                lastPolled.put(key, now);
            }

            List<ClassificationEvent> events = classifier.classify(
                    station.stationId(), pollutant, windows, station.zone(), priorDayProbe(), met);
            List<ComplianceRecord> persisted = new ArrayList<>();
            for (ClassificationEvent event : events) {
                if (isDuplicate(event)) {
                    continue;
                }
                if (advisory) {
                    LOGGER.info("Advisory " + event.tier() + " from streaming context for station="
                            + station.stationId() + " pollutant=" + pollutant.code() + "; polling is current");
                    publish(event, null, origin, false, now);
                    continue;
                }
                persisted.add(persist(event, station, origin, now));
            }
            return persisted;
        } finally {
            lock.unlock();
        }
    }

    public Map<Pollutant, List<ComplianceRecord>> evaluateAll(
            Origin origin,
            StationConfig station,
            Map<Pollutant, List<WindowResult>> windowsByPollutant,
            MetContext met
    ) {
        Map<Pollutant, List<ComplianceRecord>> results = new LinkedHashMap<>();
        windowsByPollutant.forEach((pollutant, windows) -> {
            List<ComplianceRecord> persisted = evaluate(origin, station, pollutant, windows, met);
            if (!persisted.isEmpty()) {
                results.put(pollutant, persisted);
            }
        });
        return results;
    }

    Optional<Instant> lastPolledAt(String stationId, Pollutant pollutant) {
        return Optional.ofNullable(lastPolled.get(new Key(stationId, pollutant)));
    }

    private boolean pollingFresh(Key key, Instant now) {
        Instant polled = lastPolled.get(key);
        return polled != null && Duration.between(polled, now).compareTo(pollingStaleAfter) < 0;
    }

    private boolean isDuplicate(ClassificationEvent event) {
        Optional<ComplianceRecord> existing = eventStore.findOpenOverlapping(
                event.stationId(), event.pollutant(), event.tier(), event.windowEnd().minus(DEDUP_HORIZON));
        if (existing.isPresent() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Skipping duplicate: station=" + event.stationId() + " pollutant=" + event.pollutant().code()
                    + " tier=" + event.tier() + " existing=" + existing.get().id());
        }
        return existing.isPresent();
    }

    private ConsecutiveBreachProbe priorDayProbe() {
        return (stationId, pollutant) -> {
            Instant now = clock.instant();
            return eventStore.hasViolationBetween(stationId, pollutant, now.minus(PRIOR_DAY_START), now.minus(PRIOR_DAY_END));
        };
    }

    private ComplianceRecord persist(ClassificationEvent event, StationConfig station, Origin origin, Instant now) {
        String id = UUID.randomUUID().toString();
        LedgerEntry entry = ledgerWriter.append(LedgerEventTypes.COMPLIANCE_EVENT, id, ledgerPayload(id, event, station, origin));
        ComplianceRecord record = new ComplianceRecord(id, event, event.status(), now);
        eventStore.save(record);

        Level level = event.tier() == Tier.MONITOR ? Level.INFO : Level.WARNING;
        LOGGER.log(level, event.tier() + " recorded: id=" + id + " station=" + event.stationId()
                + " pollutant=" + event.pollutant().code() + " window=" + event.horizon().hours() + "h"
                + " ledger=#" + entry.sequenceNumber());
        publish(event, id, origin, true, now);
        eventBus.publish(new LedgerEntryAppended(
                now, entry.sequenceNumber(), entry.eventType(), entry.eventId(), entry.entryHash()));
        return record;
    }

    private void publish(ClassificationEvent event, String id, Origin origin, boolean persisted, Instant now) {
        eventBus.publish(new ComplianceEventRaised(
                now,
                id,
                event.stationId(),
                event.pollutant().code(),
                event.tier().name(),
                event.status().name(),
                event.horizon().hours(),
                event.observedValue(),
                event.limitValue(),
                origin.name(),
                persisted
        ));
    }

    static Map<String, Object> ledgerPayload(String id, ClassificationEvent event, StationConfig station, Origin origin) {
        RuleResult rule = event.ruleResult();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("event_id", id);
        data.put("station_id", event.stationId());
        data.put("zone", station.zone());
        data.put("pollutant", event.pollutant().code());
        data.put("tier", event.tier().name());
        data.put("status", event.status().name());
        data.put("averaging_period", rule.averagingPeriod().label());
        data.put("window_start", event.windowStart().toString());
        data.put("window_end", event.windowEnd().toString());
        data.put("observed_value", rule.observedValue());
        data.put("limit_value", rule.limitValue());
        data.put("exceedance_value", rule.exceedanceValue());
        data.put("exceedance_percent", rule.exceedancePercent());
        data.put("rule_name", rule.ruleName());
        data.put("legal_reference", rule.legalReference());
        data.put("rule_version", rule.ruleVersion());
        data.put("consecutive_day_breach", event.consecutiveDayBreach());
        data.put("origin", origin.name());
        if (event.met() != null && !event.met().isEmpty()) {
            data.put("met_context", event.met().toMap());
        }
        return data;
    }

    private record Key(String stationId, Pollutant pollutant) {
    }
}
