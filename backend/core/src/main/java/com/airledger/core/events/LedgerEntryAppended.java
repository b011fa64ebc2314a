package com.airledger.core.events;

import java.time.Instant;

public record LedgerEntryAppended(
        Instant timestamp,
        long sequenceNumber,
        String eventType,
        String eventId,
        String entryHash
) implements Event {
    @Override
    public String type() {
        return "LedgerEntryAppended";
    }
}
