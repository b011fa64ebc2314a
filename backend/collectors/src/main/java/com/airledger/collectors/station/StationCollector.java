package com.airledger.collectors.station;

import com.airledger.collectors.api.Collector;
import com.airledger.collectors.api.CollectorContext;
import com.airledger.collectors.api.CollectorResult;
import com.airledger.collectors.api.ReadingSink;
import com.airledger.collectors.api.ReadingStore;
import com.airledger.collectors.compliance.ClassificationPipeline;
import com.airledger.collectors.compliance.Origin;
import com.airledger.collectors.config.StationCollectorConfig;
import com.airledger.collectors.ingestion.ReadingProvider;
import com.airledger.collectors.weather.WeatherContext;
import com.airledger.collectors.weather.WeatherProvider;
import com.airledger.core.confidence.ConfidenceScorer;
import com.airledger.core.events.AlertRaised;
import com.airledger.core.events.CollectorTickCompleted;
import com.airledger.core.events.CollectorTickStarted;
import com.airledger.core.events.ReadingQuarantined;
import com.airledger.core.events.ReadingRejected;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.ConfidenceResult;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.StationConfig;
import com.airledger.core.model.ValidationResult;
import com.airledger.core.model.WindowResult;
import com.airledger.core.validation.ReadingValidator;
import com.airledger.core.window.PointInTimeWindowCalculator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * The scheduled polling context. Each tick fetches every configured station, fills missing weather,
 * validates, cross-checks against neighbors, stores the accepted reading, hands it to the streaming
 * context and classifies windows recomputed from the stored history.
 */
public class StationCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(StationCollector.class.getName());

    public static final String CONFIG_KEY = "stationCollector";
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(300);
    static final Duration NEIGHBOR_MAX_AGE = Duration.ofHours(1);

    private final ReadingProvider readingProvider;
    private final WeatherProvider weatherProvider;
    private final ReadingValidator validator;
    private final ConfidenceScorer scorer;
    private final ReadingStore readingStore;
    private final ClassificationPipeline pipeline;
    private final ReadingSink streamingSink;
    private final Duration interval;

    public StationCollector(
            ReadingProvider readingProvider,
            WeatherProvider weatherProvider,
            ReadingValidator validator,
            ConfidenceScorer scorer,
            ReadingStore readingStore,
            ClassificationPipeline pipeline,
            ReadingSink streamingSink,
            Duration interval
    ) {
        this.readingProvider = readingProvider;
        this.weatherProvider = weatherProvider;
        this.validator = validator;
        this.scorer = scorer;
        this.readingStore = readingStore;
        this.pipeline = pipeline;
        this.streamingSink = streamingSink;
        this.interval = interval;
    }

    @Override
    public String name() {
        return CONFIG_KEY;
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        StationCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, StationCollectorConfig.class);
        List<CompletableFuture<StationPollOutcome>> tasks = cfg.stations().stream()
                .map(station -> CompletableFuture.supplyAsync(() -> pollStation(station, ctx))
                        .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(error -> failedOutcome(station, ctx, error)))
                .toList();

        CompletableFuture<CollectorResult> pipelineFuture = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> summarize(tasks.stream().map(CompletableFuture::join).toList()));

        return pipelineFuture.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("Station collector failed: " + rootMessage(error), Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), result.success(), durationMillis));
            return result;
        });
    }

    private StationPollOutcome pollStation(StationConfig station, CollectorContext ctx) {
        Optional<Reading> fetched = readingProvider.fetch(station);
        if (fetched.isEmpty()) {
            streamingSink.stationOffline(station.stationId());
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "collector",
                    "No reading this cycle for station " + station.stationId(),
                    Map.of("collector", name(), "station", station.stationId())
            ));
            return new StationPollOutcome(station.stationId(), Status.NO_READING, 0);
        }

        Reading reading = fetched.get();
        Optional<WeatherContext> weather = weatherProvider.current(station);
        if (weather.isPresent()) {
            reading = reading.withMet(reading.met().mergedWith(weather.get().toMetContext()));
        }

        ValidationResult validation = validator.validate(reading);
        if (!validation.valid()) {
            ctx.eventBus().publish(new ReadingRejected(
                    ctx.clock().instant(), station.stationId(), reading.timestamp(), validation.reasons()));
            return new StationPollOutcome(station.stationId(), Status.REJECTED, 0);
        }

        Reading accepted = dropQuarantined(reading, station, ctx);
        if (!accepted.hasAnyPollutant()) {
            return new StationPollOutcome(station.stationId(), Status.QUARANTINED, 0);
        }

        readingStore.append(accepted);

        Map<Pollutant, List<WindowResult>> windows = new PointInTimeWindowCalculator(readingStore)
                .currentAveragesForAll(station.stationId(), ctx.clock().instant());
        Map<Pollutant, List<ComplianceRecord>> recorded = pipeline.evaluateAll(Origin.POLLING, station, windows, null);
        // Only after the polling evaluation has marked the keys as polled.
        streamingSink.push(accepted);
        int eventCount = recorded.values().stream().mapToInt(List::size).sum();
        return new StationPollOutcome(station.stationId(), Status.ACCEPTED, eventCount);
    }

    private Reading dropQuarantined(Reading reading, StationConfig station, CollectorContext ctx) {
        List<Reading> neighbors = new ArrayList<>();
        for (String neighborId : station.neighbors()) {
            readingStore.latest(neighborId)
                    .filter(neighbor -> isRecentNeighbor(neighbor, reading.timestamp()))
                    .ifPresent(neighbors::add);
        }

        Map<Pollutant, ConfidenceResult> confidence = scorer.scoreAll(reading, neighbors);
        Map<Pollutant, Double> kept = new EnumMap<>(Pollutant.class);
        for (Map.Entry<Pollutant, Double> entry : reading.pollutants().entrySet()) {
            ConfidenceResult result = confidence.get(entry.getKey());
            if (result != null && result.quarantined()) {
                ctx.eventBus().publish(new ReadingQuarantined(
                        ctx.clock().instant(),
                        station.stationId(),
                        entry.getKey().code(),
                        result.observedValue(),
                        result.score(),
                        result.reason()
                ));
                continue;
            }
            kept.put(entry.getKey(), entry.getValue());
        }
        if (kept.size() == reading.pollutants().size()) {
            return reading;
        }
        return new Reading(reading.stationId(), reading.timestamp(), kept, reading.met(), reading.source());
    }

    private static boolean isRecentNeighbor(Reading neighbor, Instant reference) {
        Duration gap = Duration.between(neighbor.timestamp(), reference).abs();
        return gap.compareTo(NEIGHBOR_MAX_AGE) <= 0;
    }

    private StationPollOutcome failedOutcome(StationConfig station, CollectorContext ctx, Throwable error) {
        LOGGER.warning("Station poll failed for " + station.stationId() + ": " + rootMessage(error));
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                "Station poll failed for " + station.stationId() + ": " + rootMessage(error),
                Map.of("collector", name(), "station", station.stationId())
        ));
        return new StationPollOutcome(station.stationId(), Status.FAILED, 0);
    }

    private CollectorResult summarize(List<StationPollOutcome> outcomes) {
        Map<Status, Long> byStatus = new EnumMap<>(Status.class);
        for (StationPollOutcome outcome : outcomes) {
            byStatus.merge(outcome.status(), 1L, Long::sum);
        }
        int events = outcomes.stream().mapToInt(StationPollOutcome::eventCount).sum();

        Map<String, Object> stats = new HashMap<>();
        stats.put("stations", outcomes.size());
        stats.put("accepted", byStatus.getOrDefault(Status.ACCEPTED, 0L));
        stats.put("rejected", byStatus.getOrDefault(Status.REJECTED, 0L));
        stats.put("quarantined", byStatus.getOrDefault(Status.QUARANTINED, 0L));
        stats.put("noReading", byStatus.getOrDefault(Status.NO_READING, 0L));
        stats.put("failed", byStatus.getOrDefault(Status.FAILED, 0L));
        stats.put("complianceEvents", events);

        LOGGER.info("Polling cycle complete: " + stats);
        if (byStatus.getOrDefault(Status.FAILED, 0L) == 0L) {
            return CollectorResult.success("Station polling completed", stats);
        }
        return CollectorResult.failure("Station polling had failures", stats);
    }

    private enum Status {
        ACCEPTED,
        REJECTED,
        QUARANTINED,
        NO_READING,
        FAILED
    }

    private record StationPollOutcome(String stationId, Status status, int eventCount) {
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
