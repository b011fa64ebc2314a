package com.airledger.collectors.weather;

import com.airledger.core.model.MetContext;

/**
 * Current conditions at a station location. All measurements are optional.
 */
public record WeatherContext(
        Double temperature,
        Double feelsLike,
        Double humidity,
        Double pressure,
        Double windSpeed,
        Double windDirection,
        Double windGust,
        Double visibility,
        Double cloudCover,
        String description
) {
    static final double CALM_WIND_MPS = 2.0;
    static final double HUMID_PERCENT = 80.0;

    /**
     * Calm and humid air suggests a temperature inversion that traps pollutants near the ground.
     */
    public boolean inversionLikely() {
        if (temperature == null || humidity == null || windSpeed == null) {
            return false;
        }
        return windSpeed < CALM_WIND_MPS && humidity > HUMID_PERCENT;
    }

    public MetContext toMetContext() {
        return new MetContext(temperature, humidity, windSpeed, windDirection, pressure, null, inversionLikely());
    }
}
