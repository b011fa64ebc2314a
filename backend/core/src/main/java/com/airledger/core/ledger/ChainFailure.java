package com.airledger.core.ledger;

public enum ChainFailure {
    /** Sequence numbers are not contiguous. */
    SEQUENCE_GAP,
    /** An entry's previous hash does not match its predecessor's hash. */
    CHAIN_BROKEN,
    /** Recomputing the hash from the stored payload does not match the stored hash. */
    TAMPERED_ENTRY
}
