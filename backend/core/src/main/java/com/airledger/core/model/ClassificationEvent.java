package com.airledger.core.model;

import java.time.Instant;

public record ClassificationEvent(
        String stationId,
        Pollutant pollutant,
        Tier tier,
        EventStatus status,
        RuleResult ruleResult,
        WindowHorizon horizon,
        Instant windowStart,
        Instant windowEnd,
        MetContext met,
        boolean consecutiveDayBreach
) {
    public double observedValue() {
        return ruleResult.observedValue();
    }

    public double limitValue() {
        return ruleResult.limitValue();
    }

    public double exceedancePercent() {
        return ruleResult.exceedancePercent();
    }
}
