package com.airledger.core.ledger;

import com.airledger.core.model.LedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for ledger entries. Implementations must refuse to overwrite an existing sequence
 * number; there is deliberately no update or delete operation.
 */
public interface LedgerStore {
    Optional<LedgerEntry> tail();

    void insert(LedgerEntry entry);

    /**
     * @return every entry ordered by sequence number ascending
     */
    List<LedgerEntry> readAll();

    default long size() {
        return readAll().size();
    }
}
