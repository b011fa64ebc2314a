package com.airledger.collectors.ingestion;

import com.airledger.core.model.Reading;
import com.airledger.core.model.StationConfig;

import java.util.Optional;

/**
 * Fetches the latest observation for a station. Network, timeout and payload problems are reported as an
 * empty result, never thrown.
 */
public interface ReadingProvider {
    Optional<Reading> fetch(StationConfig station);
}
