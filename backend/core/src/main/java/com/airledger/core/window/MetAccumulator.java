package com.airledger.core.window;

import com.airledger.core.model.MetContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Deque;
import java.util.Iterator;

/**
 * Running means of the averaged meteorological fields, summed exactly as decimals. Wind direction and
 * the inversion flag are not averaged; the snapshot takes the latest sample that carries them.
 */
final class MetAccumulator {
    private final BigDecimal[] sums = {
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO
    };
    private final int[] counts = new int[5];

    void add(MetContext met) {
        apply(met, 1);
    }

    void remove(MetContext met) {
        apply(met, -1);
    }

    void reset() {
        for (int i = 0; i < sums.length; i++) {
            sums[i] = BigDecimal.ZERO;
            counts[i] = 0;
        }
    }

    MetContext snapshot(Deque<Sample> samples) {
        Double windDirection = null;
        Boolean inversion = null;
        Iterator<Sample> newestFirst = samples.descendingIterator();
        while (newestFirst.hasNext() && (windDirection == null || inversion == null)) {
            MetContext met = newestFirst.next().met();
            if (windDirection == null) {
                windDirection = met.windDirection();
            }
            if (inversion == null) {
                inversion = met.inversionLikely();
            }
        }
        return new MetContext(mean(0), mean(1), mean(2), windDirection, mean(3), mean(4), inversion);
    }

    private void apply(MetContext met, int sign) {
        accumulate(0, met.temperature(), sign);
        accumulate(1, met.humidity(), sign);
        accumulate(2, met.windSpeed(), sign);
        accumulate(3, met.pressure(), sign);
        accumulate(4, met.dewPoint(), sign);
    }

    private void accumulate(int index, Double value, int sign) {
        if (value == null) {
            return;
        }
        BigDecimal exact = BigDecimal.valueOf(value);
        sums[index] = sign > 0 ? sums[index].add(exact) : sums[index].subtract(exact);
        counts[index] += sign;
        if (counts[index] == 0) {
            sums[index] = BigDecimal.ZERO;
        }
    }

    private Double mean(int index) {
        if (counts[index] == 0) {
            return null;
        }
        return sums[index].divide(BigDecimal.valueOf(counts[index]), 2, RoundingMode.HALF_UP).doubleValue();
    }
}
