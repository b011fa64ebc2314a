package com.airledger.collectors.weather;

import com.airledger.core.model.StationConfig;

import java.util.Optional;

public interface WeatherProvider {
    Optional<WeatherContext> current(StationConfig station);
}
