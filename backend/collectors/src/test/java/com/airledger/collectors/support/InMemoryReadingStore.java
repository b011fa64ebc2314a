package com.airledger.collectors.support;

import com.airledger.collectors.api.ReadingStore;
import com.airledger.core.model.Reading;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryReadingStore implements ReadingStore {
    private final List<Reading> readings = new ArrayList<>();

    @Override
    public synchronized void append(Reading reading) {
        readings.add(reading);
        readings.sort(Comparator.comparing(Reading::timestamp));
    }

    @Override
    public synchronized Optional<Reading> latest(String stationId) {
        Reading latest = null;
        for (Reading reading : readings) {
            if (reading.stationId().equals(stationId)) {
                latest = reading;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public synchronized List<Reading> readingsSince(String stationId, Instant since) {
        return readings.stream()
                .filter(reading -> reading.stationId().equals(stationId))
                .filter(reading -> reading.timestamp().isAfter(since))
                .toList();
    }

    public synchronized List<Reading> all(String stationId) {
        return readingsSince(stationId, Instant.MIN);
    }
}
