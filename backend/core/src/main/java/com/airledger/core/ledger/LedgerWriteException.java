package com.airledger.core.ledger;

/**
 * A ledger append failed at the storage boundary. Never retried automatically: a retry could allocate the
 * same sequence number twice.
 */
public class LedgerWriteException extends RuntimeException {
    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
