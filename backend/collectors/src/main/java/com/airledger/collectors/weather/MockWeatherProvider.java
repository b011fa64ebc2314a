package com.airledger.collectors.weather;

import com.airledger.core.model.StationConfig;
import com.airledger.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class MockWeatherProvider implements WeatherProvider {
    private final Map<String, WeatherContext> conditions = new ConcurrentHashMap<>();

    public MockWeatherProvider(Path jsonFile) {
        try (InputStream in = Files.newInputStream(jsonFile)) {
            WeatherFixture fixture = JsonUtils.objectMapper().readValue(in, WeatherFixture.class);
            fixture.stations().forEach(entry -> conditions.put(
                    entry.stationId(),
                    new WeatherContext(
                            entry.temperature(),
                            entry.temperature(),
                            entry.humidity(),
                            entry.pressure(),
                            entry.windSpeed(),
                            entry.windDirection(),
                            null,
                            null,
                            null,
                            entry.description()
                    )
            ));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading weather fixture: " + jsonFile, e);
        }
    }

    @Override
    public Optional<WeatherContext> current(StationConfig station) {
        return Optional.ofNullable(conditions.get(station.stationId()));
    }

    private record WeatherFixture(List<WeatherEntry> stations) {
    }

    private record WeatherEntry(
            String stationId,
            Double temperature,
            Double humidity,
            Double pressure,
            Double windSpeed,
            Double windDirection,
            String description
    ) {
    }
}
