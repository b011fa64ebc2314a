package com.airledger.service.store;

import com.airledger.core.ledger.LedgerStore;
import com.airledger.core.ledger.LedgerWriteException;
import com.airledger.core.model.LedgerEntry;
import com.airledger.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSONL ledger file. The file is opened for append only and an insert whose sequence does not
 * follow the current tail is refused, so earlier lines are never rewritten from here.
 */
public class JsonlLedgerStore implements LedgerStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private LedgerEntry tail;
    private boolean tailLoaded;

    public JsonlLedgerStore(Path file) {
        this.file = file;
    }

    @Override
    public Optional<LedgerEntry> tail() {
        lock.lock();
        try {
            if (!tailLoaded) {
                List<LedgerEntry> entries = readAll();
                tail = entries.isEmpty() ? null : entries.get(entries.size() - 1);
                tailLoaded = true;
            }
            return Optional.ofNullable(tail);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void insert(LedgerEntry entry) {
        lock.lock();
        try {
            long expected = tail().map(current -> current.sequenceNumber() + 1).orElse(1L);
            if (entry.sequenceNumber() != expected) {
                throw new LedgerWriteException(
                        "Refusing ledger insert with sequence " + entry.sequenceNumber() + ", expected " + expected, null);
            }
            JsonlFiles.appendLine(file, MAPPER.writeValueAsString(entry));
            tail = entry;
        } catch (IOException e) {
            throw new LedgerWriteException("Failed appending ledger entry to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LedgerEntry> readAll() {
        lock.lock();
        try {
            List<LedgerEntry> entries = new ArrayList<>();
            int lineNumber = 0;
            for (String line : JsonlFiles.nonBlankLines(file)) {
                lineNumber++;
                try {
                    entries.add(MAPPER.readValue(line, LedgerEntry.class));
                } catch (IOException decodeError) {
                    throw new IllegalStateException("Invalid ledger entry at line " + lineNumber + " of " + file, decodeError);
                }
            }
            return entries;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading ledger " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
