package com.airledger.core.ledger;

import com.airledger.core.model.LedgerEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

public final class InMemoryLedgerStore implements LedgerStore {
    private final ConcurrentSkipListMap<Long, LedgerEntry> entries = new ConcurrentSkipListMap<>();

    @Override
    public Optional<LedgerEntry> tail() {
        var last = entries.lastEntry();
        return last == null ? Optional.empty() : Optional.of(last.getValue());
    }

    @Override
    public void insert(LedgerEntry entry) {
        LedgerEntry existing = entries.putIfAbsent(entry.sequenceNumber(), entry);
        if (existing != null) {
            throw new IllegalStateException("Ledger sequence " + entry.sequenceNumber() + " already written");
        }
    }

    @Override
    public List<LedgerEntry> readAll() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public long size() {
        return entries.size();
    }
}
