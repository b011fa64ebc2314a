package com.airledger.core.ledger;

import com.airledger.core.model.LedgerEntry;

import java.util.List;
import java.util.logging.Logger;

/**
 * Re-walks the whole chain from the first entry. Stops at the first failure and never repairs.
 */
public final class LedgerVerifier {
    private static final Logger LOGGER = Logger.getLogger(LedgerVerifier.class.getName());

    private final LedgerStore store;

    public LedgerVerifier(LedgerStore store) {
        this.store = store;
    }

    public ChainVerificationResult verifyChain() {
        List<LedgerEntry> entries = store.readAll();
        long total = entries.size();
        if (entries.isEmpty()) {
            return ChainVerificationResult.ok(0);
        }

        long expectedSequence = entries.get(0).sequenceNumber();
        String expectedPrevHash = LedgerEntry.GENESIS_PREV_HASH;
        for (LedgerEntry entry : entries) {
            long sequence = entry.sequenceNumber();
            if (sequence != expectedSequence) {
                return fail(total, sequence, ChainFailure.SEQUENCE_GAP,
                        "Sequence gap: expected " + expectedSequence + ", found " + sequence);
            }
            if (!expectedPrevHash.equals(entry.prevHash())) {
                return fail(total, sequence, ChainFailure.CHAIN_BROKEN,
                        "Chain broken at sequence " + sequence + ": prev_hash does not match preceding entry");
            }
            String recomputed = LedgerWriter.computeHash(entry.eventData(), entry.prevHash());
            if (!recomputed.equals(entry.entryHash())) {
                return fail(total, sequence, ChainFailure.TAMPERED_ENTRY,
                        "Tampered entry at sequence " + sequence + ": stored hash does not match payload");
            }
            expectedPrevHash = entry.entryHash();
            expectedSequence++;
        }
        LOGGER.info("Ledger chain verified: " + total + " entries intact");
        return ChainVerificationResult.ok(total);
    }

    private static ChainVerificationResult fail(long total, long sequence, ChainFailure failure, String message) {
        LOGGER.severe("Ledger verification failed (" + failure + "): " + message);
        return ChainVerificationResult.broken(total, sequence, failure, message);
    }
}
