package com.airledger.core.model;

import java.util.List;

public record StationConfig(
        String stationId,
        String name,
        String waqiId,
        String zone,
        Double latitude,
        Double longitude,
        List<String> neighbors
) {
    public static final String DEFAULT_ZONE = "residential";

    public StationConfig {
        zone = zone == null || zone.isBlank() ? DEFAULT_ZONE : zone;
        neighbors = neighbors == null ? List.of() : List.copyOf(neighbors);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
