package com.airledger.core.window;

import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes every horizon from the stored reading history at a given instant. Uses the same per-horizon
 * accumulation as {@link RollingWindowEngine}, so both agree for the same history and instant.
 */
public final class PointInTimeWindowCalculator implements WindowView {
    private final ReadingHistory history;

    public PointInTimeWindowCalculator(ReadingHistory history) {
        this.history = history;
    }

    @Override
    public List<WindowResult> currentAverages(String stationId, Pollutant pollutant, Instant asOf) {
        return compute(stationId, pollutant, load(stationId, asOf), asOf);
    }

    /**
     * Window results for every pollutant that has at least one reading in the longest horizon.
     */
    public Map<Pollutant, List<WindowResult>> currentAveragesForAll(String stationId, Instant asOf) {
        List<Reading> readings = load(stationId, asOf);
        Map<Pollutant, List<WindowResult>> results = new EnumMap<>(Pollutant.class);
        for (Pollutant pollutant : Pollutant.values()) {
            List<WindowResult> windows = compute(stationId, pollutant, readings, asOf);
            if (!windows.isEmpty()) {
                results.put(pollutant, windows);
            }
        }
        return results;
    }

    public static List<WindowResult> compute(
            String stationId,
            Pollutant pollutant,
            Collection<Reading> readings,
            Instant asOf
    ) {
        List<Reading> ordered = new ArrayList<>(readings);
        ordered.sort(Comparator.comparing(Reading::timestamp));
        List<WindowResult> results = new ArrayList<>();
        for (WindowHorizon horizon : WindowHorizon.values()) {
            HorizonWindow window = new HorizonWindow(horizon);
            Instant lowerBound = asOf.minus(horizon.duration());
            for (Reading reading : ordered) {
                Double value = reading.pollutants().get(pollutant);
                if (value == null) {
                    continue;
                }
                Instant timestamp = reading.timestamp();
                if (timestamp.isAfter(lowerBound) && !timestamp.isAfter(asOf)) {
                    window.add(new Sample(timestamp, value, reading.met()));
                }
            }
            window.summarize(stationId, pollutant).ifPresent(results::add);
        }
        return results;
    }

    private List<Reading> load(String stationId, Instant asOf) {
        return history.readingsSince(stationId, asOf.minus(WindowHorizon.longest().duration()));
    }
}
