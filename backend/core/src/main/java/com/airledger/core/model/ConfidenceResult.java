package com.airledger.core.model;

public record ConfidenceResult(
        String stationId,
        Pollutant pollutant,
        double observedValue,
        Double neighborAverage,
        Double deviationRatio,
        double score,
        boolean quarantined,
        String reason
) {
    @Override
    public String toString() {
        return "[" + (quarantined ? "QUARANTINED" : "OK") + "] station=" + stationId
                + " pollutant=" + pollutant.code()
                + " value=" + observedValue
                + " neighbor_avg=" + neighborAverage
                + " score=" + score;
    }
}
