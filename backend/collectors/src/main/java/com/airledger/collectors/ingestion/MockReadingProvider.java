package com.airledger.collectors.ingestion;

import com.airledger.core.model.MetContext;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.SourceMetadata;
import com.airledger.core.model.StationConfig;
import com.airledger.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves fixed pollutant values per station from a fixture file, stamped with the current clock instant.
 */
public class MockReadingProvider implements ReadingProvider {
    private final Map<String, ReadingEntry> readings = new ConcurrentHashMap<>();
    private final Clock clock;

    public MockReadingProvider(Path jsonFile, Clock clock) {
        this.clock = clock;
        try (InputStream in = Files.newInputStream(jsonFile)) {
            ReadingFixture fixture = JsonUtils.objectMapper().readValue(in, ReadingFixture.class);
            fixture.stations().forEach(entry -> readings.put(entry.stationId(), entry));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading reading fixture: " + jsonFile, e);
        }
    }

    @Override
    public Optional<Reading> fetch(StationConfig station) {
        ReadingEntry entry = readings.get(station.stationId());
        if (entry == null) {
            return Optional.empty();
        }
        Map<Pollutant, Double> pollutants = new EnumMap<>(Pollutant.class);
        entry.pollutants().forEach((key, value) -> Pollutant.fromKey(key).ifPresent(p -> pollutants.put(p, value)));
        return Optional.of(new Reading(
                station.stationId(),
                clock.instant(),
                pollutants,
                entry.met(),
                SourceMetadata.of("mock")
        ));
    }

    public void put(String stationId, Map<String, Double> pollutants) {
        readings.put(stationId, new ReadingEntry(stationId, pollutants, MetContext.EMPTY));
    }

    private record ReadingFixture(List<ReadingEntry> stations) {
    }

    private record ReadingEntry(String stationId, Map<String, Double> pollutants, MetContext met) {
    }
}
