package com.airledger.service.store;

import com.airledger.collectors.api.ReadingStore;
import com.airledger.core.model.Reading;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Reading history appended to a JSONL file and indexed in memory per station. The in-memory index keeps
 * only {@link #RETENTION}; the file keeps everything.
 */
public class JsonlReadingStore implements ReadingStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlReadingStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    static final Duration RETENTION = Duration.ofHours(48);

    private final Path file;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Reading>> byStation = new ConcurrentHashMap<>();

    public JsonlReadingStore(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        loadIfPresent();
    }

    @Override
    public void append(Reading reading) {
        lock.lock();
        try {
            JsonlFiles.appendLine(file, MAPPER.writeValueAsString(reading));
            index(reading);
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending reading to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Reading> readingsSince(String stationId, Instant since) {
        lock.lock();
        try {
            List<Reading> result = new ArrayList<>();
            for (Reading reading : byStation.getOrDefault(stationId, List.of())) {
                if (reading.timestamp().isAfter(since)) {
                    result.add(reading);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Reading> latest(String stationId) {
        lock.lock();
        try {
            List<Reading> readings = byStation.get(stationId);
            return readings == null || readings.isEmpty()
                    ? Optional.empty()
                    : Optional.of(readings.get(readings.size() - 1));
        } finally {
            lock.unlock();
        }
    }

    private void index(Reading reading) {
        List<Reading> readings = byStation.computeIfAbsent(reading.stationId(), ignored -> new ArrayList<>());
        readings.add(reading);
        readings.sort(Comparator.comparing(Reading::timestamp));
        Instant cutoff = clock.instant().minus(RETENTION);
        readings.removeIf(stored -> stored.timestamp().isBefore(cutoff));
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            int loaded = 0;
            for (String line : JsonlFiles.nonBlankLines(file)) {
                index(MAPPER.readValue(line, Reading.class));
                loaded++;
            }
            if (loaded > 0) {
                LOGGER.info("Loaded " + loaded + " readings from " + file);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading readings from " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
