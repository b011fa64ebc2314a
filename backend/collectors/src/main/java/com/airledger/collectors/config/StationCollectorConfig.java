package com.airledger.collectors.config;

import com.airledger.core.model.StationConfig;

import java.time.Duration;
import java.util.List;

public record StationCollectorConfig(Duration interval, List<StationConfig> stations) {
}
