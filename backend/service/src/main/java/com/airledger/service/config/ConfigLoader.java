package com.airledger.service.config;

import com.airledger.core.classification.ZoneAdjustments;
import com.airledger.core.model.CollectorConfig;
import com.airledger.core.model.StationConfig;
import com.airledger.core.rules.RegulatoryLimits;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConfigLoader {
    public static final String REGULATORY_LIMITS_FILE = "regulatory-limits.json";
    public static final String ZONES_FILE = "zones.json";
    public static final String STATIONS_FILE = "stations.json";
    public static final String COLLECTORS_FILE = "collectors.json";

    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve(COLLECTORS_FILE), new TypeReference<>() {
        });
    }

    /**
     * @throws IllegalStateException if the file is unreadable or two stations share an id
     */
    public static List<StationConfig> loadStations(Path configDir) {
        Path path = configDir.resolve(STATIONS_FILE);
        List<StationConfig> stations = read(path, new TypeReference<>() {
        });
        Set<String> ids = new HashSet<>();
        for (StationConfig station : stations) {
            if (station.stationId() == null || station.stationId().isBlank()) {
                throw new IllegalStateException("Station without stationId in " + path);
            }
            if (!ids.add(station.stationId())) {
                throw new IllegalStateException("Duplicate station " + station.stationId() + " in " + path);
            }
        }
        return List.copyOf(stations);
    }

    /**
     * @throws com.airledger.core.rules.RegulatoryConfigurationException if the table is missing or invalid
     */
    public static RegulatoryLimits loadRegulatoryLimits(Path configDir) {
        return RegulatoryLimits.load(configDir.resolve(REGULATORY_LIMITS_FILE));
    }

    public static ZoneAdjustments loadZones(Path configDir) {
        return ZoneAdjustments.load(configDir.resolve(ZONES_FILE));
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
