package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Head pointer and lifecycle state of one audit log. {@code latestSequence} is -1
 * while the log is empty; {@code sealed} never goes back to false.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogMetadata(
    String logId,
    String tenantId,
    String scope,
    Instant createdAt,
    long latestSequence,
    Instant latestTimestamp,
    String headHash,
    long entryCount,
    boolean sealed,
    Instant sealedAt,
    String sealReason
) {

    public static AuditLogMetadata empty(String logId, String tenantId, String scope, Instant createdAt) {
        return new AuditLogMetadata(logId, tenantId, scope, createdAt, -1, null, null, 0, false, null, null);
    }

    public long nextSequence() {
        return latestSequence + 1;
    }

    AuditLogMetadata advance(AuditLogEntry entry) {
        return new AuditLogMetadata(logId, tenantId, scope, createdAt,
            entry.chain().sequence(), entry.timestamp(), entry.chain().contentHash(),
            entryCount + 1, sealed, sealedAt, sealReason);
    }

    AuditLogMetadata seal(String reason, Instant at) {
        return new AuditLogMetadata(logId, tenantId, scope, createdAt,
            latestSequence, latestTimestamp, headHash, entryCount, true, at, reason);
    }
}
