package com.airledger.core.ledger;

public record ChainVerificationResult(
        boolean valid,
        long totalEntries,
        Long brokenAtSequence,
        String errorMessage,
        ChainFailure failure
) {
    public static ChainVerificationResult ok(long totalEntries) {
        return new ChainVerificationResult(true, totalEntries, null, null, null);
    }

    public static ChainVerificationResult broken(long totalEntries, long sequence, ChainFailure failure, String message) {
        return new ChainVerificationResult(false, totalEntries, sequence, message, failure);
    }
}
