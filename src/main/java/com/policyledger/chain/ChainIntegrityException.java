package com.policyledger.chain;

/**
 * Raised when a verification pass finds a broken chain. Never recovered from
 * automatically; the caller decides how to report it.
 */
public class ChainIntegrityException extends RuntimeException {

    private final ChainVerificationResult result;

    public ChainIntegrityException(String logId, ChainVerificationResult result) {
        super("Audit chain " + logId + " is broken at sequence "
            + result.firstInvalidSequence() + ": " + result.error());
        this.result = result;
    }

    public ChainVerificationResult getResult() {
        return result;
    }

    public Long getFirstInvalidSequence() {
        return result.firstInvalidSequence();
    }
}
