package com.airledger.core.events;

import java.time.Instant;
import java.util.List;

public record ReadingRejected(
        Instant timestamp,
        String stationId,
        Instant readingTimestamp,
        List<String> reasons
) implements Event {
    @Override
    public String type() {
        return "ReadingRejected";
    }
}
