package com.airledger.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Pollutant {
    PM25("pm25", "PM2.5", "μg/m³"),
    PM10("pm10", "PM10", "μg/m³"),
    NO2("no2", "NO2", "μg/m³"),
    SO2("so2", "SO2", "μg/m³"),
    CO("co", "CO", "mg/m³"),
    O3("o3", "O3", "μg/m³");

    private final String code;
    private final String label;
    private final String unit;

    Pollutant(String code, String label, String unit) {
        this.code = code;
        this.label = label;
        this.unit = unit;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public String unit() {
        return unit;
    }

    /**
     * Resolves a pollutant from its short code ({@code pm25}) or its regulatory label ({@code PM2.5}).
     */
    public static Optional<Pollutant> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim();
        for (Pollutant pollutant : values()) {
            if (pollutant.code.equalsIgnoreCase(normalized)
                    || pollutant.label.equalsIgnoreCase(normalized)
                    || pollutant.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return Optional.of(pollutant);
            }
        }
        return Optional.empty();
    }
}
