package com.airledger.core.window;

import com.airledger.core.model.Pollutant;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Time-bounded multiset of samples for one horizon, kept in timestamp order with an exact decimal running
 * sum, so the mean does not depend on the order samples arrived or expired in.
 * A sample contributes while its timestamp lies in {@code (asOf - horizon, asOf]}. Not thread-safe.
 */
final class HorizonWindow {
    private final WindowHorizon horizon;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private final MetAccumulator met = new MetAccumulator();
    private BigDecimal sum = BigDecimal.ZERO;
    private Instant cutoff = Instant.MIN;

    HorizonWindow(WindowHorizon horizon) {
        this.horizon = horizon;
    }

    void add(Sample sample) {
        if (!sample.timestamp().isAfter(cutoff)) {
            return;
        }
        Sample last = samples.peekLast();
        if (last == null || !sample.timestamp().isBefore(last.timestamp())) {
            samples.addLast(sample);
        } else {
            List<Sample> reordered = new ArrayList<>(samples);
            reordered.add(sample);
            reordered.sort(Comparator.comparing(Sample::timestamp));
            samples.clear();
            samples.addAll(reordered);
        }
        sum = sum.add(BigDecimal.valueOf(sample.value()));
        met.add(sample.met());
    }

    /**
     * Drops every sample at or before {@code asOf - horizon}. The cutoff only moves forward.
     */
    void evict(Instant asOf) {
        Instant candidate = asOf.minus(horizon.duration());
        if (candidate.isAfter(cutoff)) {
            cutoff = candidate;
        }
        while (!samples.isEmpty() && !samples.peekFirst().timestamp().isAfter(cutoff)) {
            Sample expired = samples.pollFirst();
            sum = sum.subtract(BigDecimal.valueOf(expired.value()));
            met.remove(expired.met());
        }
        if (samples.isEmpty()) {
            sum = BigDecimal.ZERO;
            met.reset();
        }
    }

    int size() {
        return samples.size();
    }

    Optional<WindowResult> summarize(String stationId, Pollutant pollutant) {
        if (samples.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new WindowResult(
                stationId,
                pollutant,
                horizon,
                roundMean(sum, samples.size()),
                samples.size(),
                samples.peekFirst().timestamp(),
                samples.peekLast().timestamp(),
                met.snapshot(samples)
        ));
    }

    /**
     * Summary restricted to samples at or before {@code asOf}, for queries that trail the evaluation
     * cutoff. Answered from the samples still retained.
     */
    Optional<WindowResult> summarizeTrailing(String stationId, Pollutant pollutant, Instant asOf) {
        HorizonWindow view = new HorizonWindow(horizon);
        Instant lowerBound = asOf.minus(horizon.duration());
        for (Sample sample : samples) {
            if (sample.timestamp().isAfter(lowerBound) && !sample.timestamp().isAfter(asOf)) {
                view.add(sample);
            }
        }
        return view.summarize(stationId, pollutant);
    }

    static double roundMean(BigDecimal sum, int count) {
        return sum.divide(BigDecimal.valueOf(count), 4, RoundingMode.HALF_UP).doubleValue();
    }
}
