package com.airledger.core.window;

import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.WindowHorizon;
import com.airledger.core.model.WindowResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Incremental sliding windows per station and pollutant, driven by arriving readings. Each key's buffer
 * is guarded by its own monitor, so concurrent writers to the same key are serialized while distinct
 * keys proceed independently. The evaluation instant of a key follows event time: it is the latest
 * reading timestamp seen, or a later {@code asOf} passed to {@link #currentAverages}.
 */
public final class RollingWindowEngine implements WindowView {
    private static final Logger LOGGER = Logger.getLogger(RollingWindowEngine.class.getName());

    private final Map<Key, Buffer> buffers = new ConcurrentHashMap<>();
    private final Set<String> offlineStations = ConcurrentHashMap.newKeySet();

    public Map<Pollutant, List<WindowResult>> update(String stationId, Reading reading) {
        offlineStations.remove(stationId);
        Map<Pollutant, List<WindowResult>> results = new EnumMap<>(Pollutant.class);
        for (Map.Entry<Pollutant, Double> entry : reading.pollutants().entrySet()) {
            Buffer buffer = buffers.computeIfAbsent(new Key(stationId, entry.getKey()), Buffer::new);
            synchronized (buffer) {
                buffer.add(new Sample(reading.timestamp(), entry.getValue(), reading.met()));
                results.put(entry.getKey(), buffer.summarize(buffer.watermark));
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Window update: station=" + stationId + " pollutants=" + results.keySet());
        }
        return results;
    }

    @Override
    public List<WindowResult> currentAverages(String stationId, Pollutant pollutant, Instant asOf) {
        Buffer buffer = buffers.get(new Key(stationId, pollutant));
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            return buffer.summarize(asOf);
        }
    }

    /**
     * Flags a station as not reporting. Its buffers are kept and age out as evaluation time advances.
     */
    public void markStationOffline(String stationId) {
        offlineStations.add(stationId);
        LOGGER.info("Station marked offline, window buffers retained: " + stationId);
    }

    public boolean isOffline(String stationId) {
        return offlineStations.contains(stationId);
    }

    public Set<String> stations() {
        Set<String> stations = new java.util.TreeSet<>();
        for (Key key : buffers.keySet()) {
            stations.add(key.stationId());
        }
        return Collections.unmodifiableSet(stations);
    }

    private record Key(String stationId, Pollutant pollutant) {
    }

    private static final class Buffer {
        private final Key key;
        private final Map<WindowHorizon, HorizonWindow> horizons = new EnumMap<>(WindowHorizon.class);
        private Instant watermark = Instant.MIN;

        Buffer(Key key) {
            this.key = key;
            for (WindowHorizon horizon : WindowHorizon.values()) {
                horizons.put(horizon, new HorizonWindow(horizon));
            }
        }

        void add(Sample sample) {
            for (HorizonWindow window : horizons.values()) {
                window.add(sample);
            }
            if (sample.timestamp().isAfter(watermark)) {
                watermark = sample.timestamp();
            }
        }

        List<WindowResult> summarize(Instant asOf) {
            List<WindowResult> results = new ArrayList<>();
            boolean trailing = asOf.isBefore(watermark);
            for (HorizonWindow window : horizons.values()) {
                if (trailing) {
                    window.summarizeTrailing(key.stationId(), key.pollutant(), asOf).ifPresent(results::add);
                } else {
                    window.evict(asOf);
                    window.summarize(key.stationId(), key.pollutant()).ifPresent(results::add);
                }
            }
            if (!trailing) {
                watermark = asOf;
            }
            return results;
        }
    }
}
