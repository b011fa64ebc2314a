package com.airledger.core.classification;

import com.airledger.core.model.ClassificationEvent;
import com.airledger.core.model.Tier;

import java.time.Instant;
import java.util.List;

public record ClassificationResult(String stationId, List<ClassificationEvent> events, Instant timestamp) {
    public ClassificationResult {
        events = List.copyOf(events);
    }

    public boolean hasViolation() {
        return count(Tier.VIOLATION) > 0;
    }

    public boolean hasFlag() {
        return count(Tier.FLAG) > 0;
    }

    public long count(Tier tier) {
        return events.stream().filter(event -> event.tier() == tier).count();
    }
}
