package com.airledger.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LedgerEntry(
        long sequenceNumber,
        String eventType,
        String eventId,
        Map<String, Object> eventData,
        String prevHash,
        String entryHash,
        Instant createdAt
) {
    public static final String GENESIS_PREV_HASH = "0".repeat(64);

    public LedgerEntry {
        eventData = Collections.unmodifiableMap(new LinkedHashMap<>(eventData));
    }

    @JsonIgnore
    public boolean isGenesis() {
        return GENESIS_PREV_HASH.equals(prevHash);
    }
}
