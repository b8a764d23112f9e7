package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.chain.ChainVerificationResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditQueryResult(
    List<AuditLogEntry> entries,
    long total,
    boolean hasMore,
    long queryTimeMs,
    ChainVerificationResult chainVerification
) {

    public AuditQueryResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public AuditQueryResult withChainVerification(ChainVerificationResult verification) {
        return new AuditQueryResult(entries, total, hasMore, queryTimeMs, verification);
    }
}
