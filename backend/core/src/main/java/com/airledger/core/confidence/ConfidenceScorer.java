package com.airledger.core.confidence;

import com.airledger.core.model.ConfidenceResult;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scores a pollutant value against concurrent values from neighboring stations. Stateless.
 */
public final class ConfidenceScorer {
    private static final Logger LOGGER = Logger.getLogger(ConfidenceScorer.class.getName());

    public static final double QUARANTINE_THRESHOLD = 60.0;
    static final double NEUTRAL_SCORE = 70.0;
    static final double ZERO_BASELINE_SUSPICIOUS_SCORE = 20.0;
    static final double MAX_DEVIATION_FACTOR = 3.0;
    static final int MIN_NEIGHBORS = 1;

    public ConfidenceResult score(String stationId, Pollutant pollutant, double observed, Collection<Double> neighborValues) {
        if (Double.isNaN(observed) || Double.isInfinite(observed)) {
            ConfidenceResult result = new ConfidenceResult(
                    stationId, pollutant, 0.0, null, null, 0.0, true, "observed value is not a valid number");
            LOGGER.warning("Reading quarantined: " + result);
            return result;
        }

        List<Double> valid = new ArrayList<>();
        if (neighborValues != null) {
            for (Double value : neighborValues) {
                if (value != null && !value.isNaN() && !value.isInfinite() && value >= 0) {
                    valid.add(value);
                }
            }
        }

        Double neighborAverage = null;
        Double ratio = null;
        double score;
        if (valid.isEmpty()) {
            score = NEUTRAL_SCORE;
        } else {
            double sum = 0.0;
            for (double value : valid) {
                sum += value;
            }
            double average = sum / valid.size();
            neighborAverage = round(average, 4);
            if (average == 0.0) {
                if (observed == 0.0) {
                    ratio = 1.0;
                    score = 100.0;
                } else {
                    ratio = Double.POSITIVE_INFINITY;
                    score = ZERO_BASELINE_SUSPICIOUS_SCORE;
                }
            } else {
                double deviation = observed / average;
                ratio = round(deviation, 4);
                score = round(scoreForRatio(deviation), 2);
            }
        }

        boolean quarantined = score < QUARANTINE_THRESHOLD;
        String reason = null;
        if (quarantined) {
            reason = valid.size() < MIN_NEIGHBORS
                    ? "Insufficient neighbors for cross-validation"
                    : "Deviation ratio " + ratio + " indicates anomalous reading";
        }

        ConfidenceResult result = new ConfidenceResult(
                stationId, pollutant, observed, neighborAverage, ratio, score, quarantined, reason);
        if (quarantined) {
            LOGGER.warning("Reading quarantined: " + result);
        } else if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Reading confidence: " + result);
        }
        return result;
    }

    /**
     * Scores every pollutant present in {@code reading} against the same pollutant in each neighbor reading.
     */
    public Map<Pollutant, ConfidenceResult> scoreAll(Reading reading, Collection<Reading> neighbors) {
        Map<Pollutant, ConfidenceResult> results = new EnumMap<>(Pollutant.class);
        for (Map.Entry<Pollutant, Double> entry : reading.pollutants().entrySet()) {
            List<Double> neighborValues = new ArrayList<>();
            for (Reading neighbor : neighbors) {
                Optional<Double> value = neighbor.value(entry.getKey());
                value.ifPresent(neighborValues::add);
            }
            results.put(entry.getKey(), score(reading.stationId(), entry.getKey(), entry.getValue(), neighborValues));
        }
        return results;
    }

    static double scoreForRatio(double ratio) {
        if (ratio >= 0.5 && ratio <= 2.0) {
            return 100.0;
        }
        if (ratio > 2.0) {
            return Math.max(0.0, 100.0 - ((ratio - 2.0) / MAX_DEVIATION_FACTOR) * 80.0);
        }
        return Math.max(0.0, 100.0 - ((0.5 - ratio) / 0.5) * 60.0);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
