package com.airledger.core.model;

public record SourceMetadata(String provider, String stationName, Integer aqi, String sourceUrl) {
    public static SourceMetadata of(String provider) {
        return new SourceMetadata(provider, null, null, null);
    }
}
