package com.airledger.collectors.api;

import com.airledger.core.model.Reading;
import com.airledger.core.window.ReadingHistory;

import java.util.Optional;

/**
 * Durable history of accepted readings, used by the polling context to recompute windows and by
 * neighbor cross-validation.
 */
public interface ReadingStore extends ReadingHistory {
    void append(Reading reading);

    Optional<Reading> latest(String stationId);
}
