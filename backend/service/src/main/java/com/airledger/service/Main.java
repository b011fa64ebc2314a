package com.airledger.service;

import com.airledger.collectors.api.CollectorContext;
import com.airledger.collectors.compliance.ClassificationPipeline;
import com.airledger.collectors.compliance.OfficerReviewService;
import com.airledger.collectors.config.StationCollectorConfig;
import com.airledger.collectors.ingestion.MockReadingProvider;
import com.airledger.collectors.ingestion.ReadingProvider;
import com.airledger.collectors.station.StationCollector;
import com.airledger.collectors.weather.MockWeatherProvider;
import com.airledger.collectors.weather.WeatherProvider;
import com.airledger.core.bus.EventBus;
import com.airledger.core.classification.TierClassifier;
import com.airledger.core.classification.ZoneAdjustments;
import com.airledger.core.confidence.ConfidenceScorer;
import com.airledger.core.ledger.ChainVerificationResult;
import com.airledger.core.ledger.LedgerVerifier;
import com.airledger.core.ledger.LedgerWriter;
import com.airledger.core.model.CollectorConfig;
import com.airledger.core.model.StationConfig;
import com.airledger.core.rules.RegulatoryLimits;
import com.airledger.core.rules.RuleEngine;
import com.airledger.core.validation.ReadingValidator;
import com.airledger.core.window.RollingWindowEngine;
import com.airledger.service.config.ConfigLoader;
import com.airledger.service.env.OpenWeatherClient;
import com.airledger.service.env.WaqiClient;
import com.airledger.service.http.HttpClientFactory;
import com.airledger.service.runtime.SchedulerService;
import com.airledger.service.runtime.StreamingWindowService;
import com.airledger.service.store.EventCodec;
import com.airledger.service.store.JsonFileComplianceEventStore;
import com.airledger.service.store.JsonlEventStore;
import com.airledger.service.store.JsonlLedgerStore;
import com.airledger.service.store.JsonlReadingStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String MOCK_READINGS_PARAM = "mockReadingsFile";
    static final String MOCK_WEATHER_PARAM = "mockWeatherFile";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Map<String, String> env = System.getenv();
        Path configDir = Path.of(env.getOrDefault("AIRLEDGER_CONFIG_DIR", "config"));
        Path dataDir = Path.of(env.getOrDefault("AIRLEDGER_DATA_DIR", "data"));

        Components components = build(configDir, dataDir, Path.of("logs/events.jsonl"), env, Clock.systemUTC());
        components.streaming().start();
        components.scheduler().start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested; stopping polling and streaming contexts");
            components.scheduler().shutdown();
            components.streaming().stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    /**
     * Loads configuration, verifies the ledger and wires both execution contexts without starting them.
     * Mock fixture paths in the collector params resolve against the config directory.
     *
     * @throws com.airledger.core.rules.RegulatoryConfigurationException if the limit table is unavailable
     */
    static Components build(Path configDir, Path dataDir, Path eventLogFile, Map<String, String> env, Clock clock) {
        RegulatoryLimits limits = ConfigLoader.loadRegulatoryLimits(configDir);
        ZoneAdjustments zones = ConfigLoader.loadZones(configDir);
        List<StationConfig> stations = ConfigLoader.loadStations(configDir);
        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);

        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }
        Duration pollInterval = intervalFor(collectorConfigByName, StationCollector.CONFIG_KEY, StationCollector.DEFAULT_INTERVAL);

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        JsonlLedgerStore ledgerStore = new JsonlLedgerStore(dataDir.resolve("ledger.jsonl"));
        LedgerVerifier verifier = new LedgerVerifier(ledgerStore);
        ChainVerificationResult verification = verifier.verifyChain();
        if (verification.valid()) {
            LOGGER.info("Startup ledger verification passed: " + verification.totalEntries() + " entries");
        } else {
            LOGGER.severe("Startup ledger verification FAILED (" + verification.failure() + ") at sequence "
                    + verification.brokenAtSequence() + ": " + verification.errorMessage());
        }

        LedgerWriter ledgerWriter = new LedgerWriter(ledgerStore, clock);
        JsonFileComplianceEventStore complianceStore = new JsonFileComplianceEventStore(dataDir.resolve("compliance-events.json"));
        JsonlReadingStore readingStore = new JsonlReadingStore(dataDir.resolve("readings.jsonl"), clock);

        TierClassifier classifier = new TierClassifier(new RuleEngine(limits), zones, clock);
        ClassificationPipeline pipeline = new ClassificationPipeline(
                classifier, complianceStore, ledgerWriter, eventBus, clock, pollInterval);
        OfficerReviewService officerReview = new OfficerReviewService(complianceStore, ledgerWriter, eventBus, clock);

        Map<String, StationConfig> stationsById = new LinkedHashMap<>();
        stations.forEach(station -> stationsById.put(station.stationId(), station));
        StreamingWindowService streaming = new StreamingWindowService(new RollingWindowEngine(), pipeline, stationsById);

        CollectorConfig stationCollectorConfig = collectorConfigByName.get(StationCollector.CONFIG_KEY);
        HttpClient sharedHttpClient = HttpClientFactory.create(Duration.ofSeconds(5), env);
        StationCollector stationCollector = new StationCollector(
                readingProvider(stationCollectorConfig, configDir, sharedHttpClient, env, clock),
                weatherProvider(stationCollectorConfig, configDir, sharedHttpClient, env),
                new ReadingValidator(clock),
                new ConfidenceScorer(),
                readingStore,
                pipeline,
                streaming,
                pollInterval
        );

        CollectorContext context = new CollectorContext(
                eventBus,
                clock,
                Duration.ofSeconds(30),
                Map.of(StationCollector.CONFIG_KEY, new StationCollectorConfig(pollInterval, stations))
        );
        SchedulerService scheduler = new SchedulerService(List.of(new SchedulerService.ScheduledCollector(
                stationCollector,
                pollInterval,
                isEnabled(collectorConfigByName, StationCollector.CONFIG_KEY, true)
        )), context);

        return new Components(eventBus, scheduler, streaming, pipeline, officerReview, verifier, verification);
    }

    record Components(
            EventBus eventBus,
            SchedulerService scheduler,
            StreamingWindowService streaming,
            ClassificationPipeline pipeline,
            OfficerReviewService officerReview,
            LedgerVerifier verifier,
            ChainVerificationResult startupVerification
    ) {
    }

    private static ReadingProvider readingProvider(CollectorConfig config, Path configDir, HttpClient httpClient, Map<String, String> env, Clock clock) {
        Object mockFile = config == null ? null : config.params().get(MOCK_READINGS_PARAM);
        if (mockFile != null) {
            LOGGER.warning("Using mock readings from " + mockFile);
            return new MockReadingProvider(configDir.resolve(mockFile.toString()), clock);
        }
        String token = env.getOrDefault("WAQI_TOKEN", "");
        if (token.isBlank()) {
            LOGGER.warning("WAQI_TOKEN not set; stations will report no readings");
        }
        return new WaqiClient(httpClient, Duration.ofSeconds(10), clock, token);
    }

    private static WeatherProvider weatherProvider(CollectorConfig config, Path configDir, HttpClient httpClient, Map<String, String> env) {
        Object mockFile = config == null ? null : config.params().get(MOCK_WEATHER_PARAM);
        if (mockFile != null) {
            return new MockWeatherProvider(configDir.resolve(mockFile.toString()));
        }
        return new OpenWeatherClient(httpClient, Duration.ofSeconds(10), env.getOrDefault("OPENWEATHERMAP_KEY", ""));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load logging.properties: " + e.getMessage());
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config == null) {
            return fallback;
        }
        return Duration.ofSeconds(Math.max(1, config.intervalSeconds()));
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }
}
