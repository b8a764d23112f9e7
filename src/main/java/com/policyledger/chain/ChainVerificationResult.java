package com.policyledger.chain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of walking a run of audit entries.
 *
 * @param valid                 true when every checked entry passed
 * @param entriesVerified       entries examined, including the failing one
 * @param firstInvalidSequence  sequence of the first entry that failed, if any
 * @param firstInvalidId        id of that entry
 * @param error                 description of the first failure
 * @param unverifiableLinks     links skipped because the input had sequence gaps
 * @param details               per-entry results up to and including the failure
 * @param durationMs            time spent verifying
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationResult(
    boolean valid,
    int entriesVerified,
    Long firstInvalidSequence,
    String firstInvalidId,
    String error,
    int unverifiableLinks,
    List<EntryCheck> details,
    long durationMs
) {

    public ChainVerificationResult {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static ChainVerificationResult passed(int entriesVerified, int unverifiableLinks,
                                          List<EntryCheck> details, long durationMs) {
        return new ChainVerificationResult(true, entriesVerified, null, null, null,
            unverifiableLinks, details, durationMs);
    }

    public static ChainVerificationResult failed(int entriesVerified, long sequence, String entryId, String error,
                                          int unverifiableLinks, List<EntryCheck> details, long durationMs) {
        return new ChainVerificationResult(false, entriesVerified, sequence, entryId, error,
            unverifiableLinks, details, durationMs);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EntryCheck(
        String entryId,
        long sequence,
        boolean contentHashValid,
        boolean chainLinkValid,
        String expectedContentHash,
        String actualContentHash,
        String error
    ) {}
}
