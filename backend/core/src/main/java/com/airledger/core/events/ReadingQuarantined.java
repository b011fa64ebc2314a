package com.airledger.core.events;

import java.time.Instant;

public record ReadingQuarantined(
        Instant timestamp,
        String stationId,
        String pollutant,
        double observedValue,
        double score,
        String reason
) implements Event {
    @Override
    public String type() {
        return "ReadingQuarantined";
    }
}
