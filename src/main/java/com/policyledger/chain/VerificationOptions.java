package com.policyledger.chain;

/**
 * Knobs for a full integrity inspection.
 *
 * @param startSequence       first sequence to inspect, 0 when null
 * @param endSequence         last sequence to inspect, the head when null
 * @param includeEntryDetails attach the per-entry checks to the report
 * @param stopOnFirstError    stop walking entries at the first hash or link issue
 * @param verifyTimestamps    report entries timestamped before their predecessor
 * @param maxEntries          cap on entries read, unlimited when null
 */
public record VerificationOptions(
    Long startSequence,
    Long endSequence,
    boolean includeEntryDetails,
    boolean stopOnFirstError,
    boolean verifyTimestamps,
    Integer maxEntries
) {

    public static VerificationOptions defaults() {
        return new VerificationOptions(null, null, false, false, false, null);
    }

    public VerificationOptions withTimestamps() {
        return new VerificationOptions(startSequence, endSequence, includeEntryDetails, stopOnFirstError,
            true, maxEntries);
    }
}
