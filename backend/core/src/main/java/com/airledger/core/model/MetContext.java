package com.airledger.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Meteorological conditions attached to a reading or aggregated over a window. Every field is optional.
 */
public record MetContext(
        Double temperature,
        Double humidity,
        Double windSpeed,
        Double windDirection,
        Double pressure,
        Double dewPoint,
        Boolean inversionLikely
) {
    public static final MetContext EMPTY = new MetContext(null, null, null, null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return temperature == null && humidity == null && windSpeed == null && windDirection == null
                && pressure == null && dewPoint == null && inversionLikely == null;
    }

    /**
     * Fills fields missing here from {@code fallback}; present values win.
     */
    public MetContext mergedWith(MetContext fallback) {
        if (fallback == null) {
            return this;
        }
        return new MetContext(
                temperature != null ? temperature : fallback.temperature,
                humidity != null ? humidity : fallback.humidity,
                windSpeed != null ? windSpeed : fallback.windSpeed,
                windDirection != null ? windDirection : fallback.windDirection,
                pressure != null ? pressure : fallback.pressure,
                dewPoint != null ? dewPoint : fallback.dewPoint,
                inversionLikely != null ? inversionLikely : fallback.inversionLikely
        );
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "temperature", temperature);
        putIfPresent(map, "humidity", humidity);
        putIfPresent(map, "wind_speed", windSpeed);
        putIfPresent(map, "wind_direction", windDirection);
        putIfPresent(map, "pressure", pressure);
        putIfPresent(map, "dew_point", dewPoint);
        putIfPresent(map, "inversion_likely", inversionLikely);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
