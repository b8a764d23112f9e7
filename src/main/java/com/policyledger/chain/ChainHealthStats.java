package com.policyledger.chain;

import java.time.Instant;
import java.util.List;

/**
 * Shape of a chain: how much of it is present and what it was hashed with.
 * {@code sequenceEnd} is -1 and {@code timeRange} null for an empty chain.
 */
public record ChainHealthStats(
    long totalEntries,
    long entriesVerified,
    long sequenceStart,
    long sequenceEnd,
    TimeRange timeRange,
    long gapsDetected,
    long missingEntries,
    List<HashAlgorithm> algorithmsUsed,
    int continuityPercent
) {

    public ChainHealthStats {
        algorithmsUsed = algorithmsUsed == null ? List.of() : List.copyOf(algorithmsUsed);
    }

    public static ChainHealthStats empty() {
        return new ChainHealthStats(0, 0, 0, -1, null, 0, 0, List.of(), 100);
    }

    public record TimeRange(Instant start, Instant end) {}
}
