package com.airledger.core.support;

import com.airledger.core.ledger.LedgerStore;
import com.airledger.core.model.LedgerEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Ledger store whose rows can be edited or removed behind the writer's back, and which can be told to
 * fail on insert.
 */
public final class TamperableLedgerStore implements LedgerStore {
    private final List<LedgerEntry> rows = new ArrayList<>();
    private RuntimeException insertFailure;

    @Override
    public synchronized Optional<LedgerEntry> tail() {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(rows.size() - 1));
    }

    @Override
    public synchronized void insert(LedgerEntry entry) {
        if (insertFailure != null) {
            throw insertFailure;
        }
        rows.add(entry);
    }

    @Override
    public synchronized List<LedgerEntry> readAll() {
        return new ArrayList<>(rows);
    }

    public synchronized void failInsertsWith(RuntimeException failure) {
        this.insertFailure = failure;
    }

    public synchronized void rewrite(long sequence, UnaryOperator<LedgerEntry> edit) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).sequenceNumber() == sequence) {
                rows.set(i, edit.apply(rows.get(i)));
                return;
            }
        }
        throw new IllegalArgumentException("No ledger row " + sequence);
    }

    public synchronized void delete(long sequence) {
        rows.removeIf(entry -> entry.sequenceNumber() == sequence);
    }
}
