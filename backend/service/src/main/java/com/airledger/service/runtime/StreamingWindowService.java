package com.airledger.service.runtime;

import com.airledger.collectors.api.ReadingSink;
import com.airledger.collectors.compliance.ClassificationPipeline;
import com.airledger.collectors.compliance.Origin;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.Pollutant;
import com.airledger.core.model.Reading;
import com.airledger.core.model.StationConfig;
import com.airledger.core.model.WindowResult;
import com.airledger.core.window.RollingWindowEngine;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The continuous streaming context. Pushed readings are queued and consumed by one worker thread that
 * updates the incremental windows and classifies whatever changed.
 */
public class StreamingWindowService implements ReadingSink {
    private static final Logger LOGGER = Logger.getLogger(StreamingWindowService.class.getName());

    static final int QUEUE_CAPACITY = 10_000;

    private final RollingWindowEngine engine;
    private final ClassificationPipeline pipeline;
    private final Map<String, StationConfig> stations;
    private final BlockingQueue<Reading> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong pending = new AtomicLong();
    private Thread worker;

    public StreamingWindowService(RollingWindowEngine engine, ClassificationPipeline pipeline, Map<String, StationConfig> stations) {
        this.engine = engine;
        this.pipeline = pipeline;
        this.stations = Map.copyOf(stations);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        worker = new Thread(this::runLoop, "streaming-window");
        worker.setDaemon(true);
        worker.start();
        LOGGER.info("Streaming window context started for " + stations.size() + " stations");
    }

    @Override
    public void push(Reading reading) {
        pending.incrementAndGet();
        if (!queue.offer(reading)) {
            pending.decrementAndGet();
            LOGGER.warning("Streaming queue full; dropping reading for station " + reading.stationId());
        }
    }

    @Override
    public void stationOffline(String stationId) {
        engine.markStationOffline(stationId);
    }

    /**
     * Waits until every queued reading has been processed or the timeout elapses.
     *
     * @return true if the queue drained in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(5);
        }
        return true;
    }

    public long processedCount() {
        return processed.get();
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        worker.interrupt();
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Streaming window context stopped after " + processed.get() + " readings");
    }

    private void runLoop() {
        while (running.get()) {
            Reading reading;
            try {
                reading = queue.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (reading == null) {
                continue;
            }
            try {
                process(reading);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Streaming classification failed for station " + reading.stationId(), e);
            } finally {
                pending.decrementAndGet();
            }
        }
    }

    void process(Reading reading) {
        StationConfig station = stations.get(reading.stationId());
        if (station == null) {
            LOGGER.warning("Streaming reading for unknown station " + reading.stationId() + " ignored");
            return;
        }
        Map<Pollutant, List<WindowResult>> windows = engine.update(reading.stationId(), reading);
        Map<Pollutant, List<ComplianceRecord>> recorded = pipeline.evaluateAll(Origin.STREAMING, station, windows, null);
        processed.incrementAndGet();
        if (!recorded.isEmpty() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Streaming context recorded events for " + recorded.keySet() + " at " + station.stationId());
        }
    }
}
