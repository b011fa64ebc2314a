package com.airledger.core.ledger;

import com.airledger.core.model.LedgerEntry;
import com.airledger.core.util.HashingUtils;
import com.airledger.core.util.JsonUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends hash-chained entries. Sequence allocation is serialized process-wide: reading the tail, computing
 * the next hash and inserting happen under one lock.
 */
public final class LedgerWriter {
    private static final Logger LOGGER = Logger.getLogger(LedgerWriter.class.getName());

    private final LedgerStore store;
    private final Clock clock;
    private final ReentrantLock appendLock = new ReentrantLock();

    public LedgerWriter(LedgerStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @throws LedgerWriteException if the store fails to read the tail or to insert
     */
    public LedgerEntry append(String eventType, String eventId, Map<String, Object> eventData) {
        appendLock.lock();
        try {
            Optional<LedgerEntry> tail = store.tail();
            long sequence = tail.map(entry -> entry.sequenceNumber() + 1).orElse(1L);
            String prevHash = tail.map(LedgerEntry::entryHash).orElse(LedgerEntry.GENESIS_PREV_HASH);
            Instant createdAt = clock.instant();

            LedgerEntry entry = new LedgerEntry(
                    sequence,
                    eventType,
                    eventId,
                    eventData,
                    prevHash,
                    computeHash(eventData, prevHash),
                    createdAt
            );
            store.insert(entry);
            LOGGER.info("Ledger entry #" + sequence + " appended: type=" + eventType + " event=" + eventId
                    + " hash=" + entry.entryHash().substring(0, 16) + "...");
            return entry;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Ledger append failed for " + eventType + " " + eventId, e);
            if (e instanceof LedgerWriteException writeFailure) {
                throw writeFailure;
            }
            throw new LedgerWriteException("Ledger append failed for " + eventType + " " + eventId, e);
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * {@code sha256(canonicalJson(eventData) + prevHash)}.
     */
    public static String computeHash(Map<String, Object> eventData, String prevHash) {
        return HashingUtils.sha256(JsonUtils.canonicalJson(eventData) + prevHash);
    }
}
