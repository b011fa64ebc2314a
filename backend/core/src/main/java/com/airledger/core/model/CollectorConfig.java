package com.airledger.core.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public record CollectorConfig(
        String name,
        boolean enabled,
        int intervalSeconds,
        Map<String, Object> params
) {
    public CollectorConfig {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(params));
    }
}
