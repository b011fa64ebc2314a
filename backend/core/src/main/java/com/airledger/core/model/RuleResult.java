package com.airledger.core.model;

public record RuleResult(
        Pollutant pollutant,
        AveragingPeriod averagingPeriod,
        double observedValue,
        double limitValue,
        boolean withinLimit,
        double exceedanceValue,
        double exceedancePercent,
        String ruleName,
        String legalReference,
        String ruleVersion
) {
    @Override
    public String toString() {
        return "[" + (withinLimit ? "OK" : "EXCEEDED") + "] " + pollutant.code() + " " + averagingPeriod.label()
                + ": " + observedValue + " / " + limitValue + " " + pollutant.unit();
    }
}
