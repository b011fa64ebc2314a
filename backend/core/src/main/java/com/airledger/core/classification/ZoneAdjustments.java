package com.airledger.core.classification;

import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Per-zone threshold adjustment factors. The classifier divides a window average by the factor, so a
 * factor below 1.0 makes the zone stricter. Unknown zones use 1.0.
 */
public final class ZoneAdjustments {
    private static final Logger LOGGER = Logger.getLogger(ZoneAdjustments.class.getName());

    public static final double DEFAULT_FACTOR = 1.0;

    private final Map<String, Double> factors;

    public ZoneAdjustments(Map<String, Double> factors) {
        Map<String, Double> normalized = new HashMap<>();
        factors.forEach((zone, factor) -> {
            if (factor == null || factor <= 0 || factor.isNaN() || factor.isInfinite()) {
                throw new IllegalArgumentException("Zone factor for '" + zone + "' must be a positive number");
            }
            normalized.put(normalize(zone), factor);
        });
        this.factors = Collections.unmodifiableMap(normalized);
    }

    public static ZoneAdjustments none() {
        return new ZoneAdjustments(Map.of());
    }

    /**
     * Reads {@code {"roadside": {"threshold_adjustment": 0.9}, ...}}. A missing file yields defaults only.
     */
    public static ZoneAdjustments load(Path file) {
        if (!Files.exists(file)) {
            LOGGER.warning("Zone configuration not found at " + file + ", using default thresholds");
            return none();
        }
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = JsonUtils.objectMapper().readTree(in);
            Map<String, Double> factors = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> zones = root.fields();
            while (zones.hasNext()) {
                Map.Entry<String, JsonNode> zone = zones.next();
                JsonNode factor = zone.getValue().path("threshold_adjustment");
                factors.put(zone.getKey(), factor.isNumber() ? factor.asDouble() : DEFAULT_FACTOR);
            }
            return new ZoneAdjustments(factors);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + file, e);
        }
    }

    public double factorFor(String zone) {
        if (zone == null) {
            return DEFAULT_FACTOR;
        }
        return factors.getOrDefault(normalize(zone), DEFAULT_FACTOR);
    }

    public Map<String, Double> factors() {
        return factors;
    }

    private static String normalize(String zone) {
        return zone.trim().toLowerCase(Locale.ROOT);
    }
}
