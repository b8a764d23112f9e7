package com.policyledger.chain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Every issue found in a chain, most severe first, with the chain's health
 * figures. Valid only when {@code issues} is empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationReport(
    String tenantId,
    boolean valid,
    Instant verifiedAt,
    long durationMs,
    ChainHealthStats stats,
    List<IntegrityIssue> issues,
    String summary,
    List<ChainVerificationResult.EntryCheck> entryDetails
) {

    public VerificationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
        entryDetails = entryDetails == null ? null : List.copyOf(entryDetails);
    }

    public static VerificationReport empty(String tenantId, long durationMs) {
        return new VerificationReport(tenantId, true, Instant.now(), durationMs, ChainHealthStats.empty(),
            List.of(), "No entries to verify", null);
    }

    public boolean hasIssue(IntegrityIssue.Type type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }
}
