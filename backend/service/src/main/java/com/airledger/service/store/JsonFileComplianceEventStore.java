package com.airledger.service.store;

import com.airledger.collectors.api.ComplianceEventStore;
import com.airledger.core.model.ComplianceRecord;
import com.airledger.core.model.EventStatus;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Compliance events held in memory and snapshotted to one JSON file on every change.
 */
public class JsonFileComplianceEventStore implements ComplianceEventStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ComplianceRecord> records = new LinkedHashMap<>();

    public JsonFileComplianceEventStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public void save(ComplianceRecord record) {
        lock.lock();
        try {
            if (records.containsKey(record.id())) {
                throw new IllegalStateException("Compliance event already stored: " + record.id());
            }
            records.put(record.id(), record);
            persist();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ComplianceRecord> find(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ComplianceRecord updateStatus(String id, EventStatus status) {
        lock.lock();
        try {
            ComplianceRecord current = records.get(id);
            if (current == null) {
                throw new IllegalArgumentException("Compliance event '" + id + "' not found");
            }
            ComplianceRecord updated = current.withStatus(status);
            records.put(id, updated);
            persist();
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ComplianceRecord> all() {
        lock.lock();
        try {
            return new ArrayList<>(records.values());
        } finally {
            lock.unlock();
        }
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                List<ComplianceRecord> loaded = MAPPER.readValue(in, new TypeReference<List<ComplianceRecord>>() {
                });
                loaded.forEach(record -> records.put(record.id(), record));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading compliance events from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new ArrayList<>(records.values()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing compliance events to " + file, e);
        }
    }
}
