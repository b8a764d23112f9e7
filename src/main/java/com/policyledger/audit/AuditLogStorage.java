package com.policyledger.audit;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for audit logs, one log per tenant.
 *
 * Implementations never reorder or rewrite entries. Head advancement happens only
 * through {@link #appendIfHead}, which must be atomic per log.
 */
public interface AuditLogStorage {

    /** Returns the tenant's log metadata, creating an empty log on first use. */
    AuditLogMetadata getOrCreateLog(String tenantId);

    Optional<AuditLogMetadata> getMetadata(String tenantId);

    /**
     * Persists {@code entry} only if the log head still sits at
     * {@code expectedSequence}/{@code expectedHeadHash}, and advances the head.
     *
     * @throws ConcurrentAppendException if another append moved the head first
     * @throws SealedLogException if the log was sealed
     */
    void appendIfHead(AuditLogEntry entry, long expectedSequence, String expectedHeadHash);

    AuditQueryResult query(AuditQuery query);

    Optional<AuditLogEntry> getEntry(String tenantId, String entryId);

    Optional<AuditLogEntry> getEntryBySequence(String tenantId, long sequence);

    /** Entries with {@code from <= sequence <= to}, ascending. */
    List<AuditLogEntry> getEntries(String tenantId, long fromSequence, long toSequence);

    /**
     * Seals the log permanently.
     *
     * @throws SealedLogException if it is already sealed
     */
    AuditLogMetadata seal(String tenantId, String reason);
}
