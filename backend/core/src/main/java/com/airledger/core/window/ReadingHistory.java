package com.airledger.core.window;

import com.airledger.core.model.Reading;

import java.time.Instant;
import java.util.List;

/**
 * Durable reading history of a station, oldest first.
 */
@FunctionalInterface
public interface ReadingHistory {
    List<Reading> readingsSince(String stationId, Instant since);
}
