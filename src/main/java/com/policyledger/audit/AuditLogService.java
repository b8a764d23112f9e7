package com.policyledger.audit;

import com.policyledger.api.NotFoundException;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.ChainHealthStats;
import com.policyledger.chain.ChainIntegrityException;
import com.policyledger.chain.ChainVerificationResult;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.chain.HashAlgorithm;
import com.policyledger.chain.MerkleTree;
import com.policyledger.chain.VerificationOptions;
import com.policyledger.chain.VerificationReport;
import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.AuditEntryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Append-only, hash-chained audit log with one chain per tenant.
 *
 * Appends use optimistic concurrency: read the head, build and hash the entry,
 * then write conditionally on the head being unchanged. A lost race re-reads the
 * head and tries again, so several writers can share one storage backend.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private static final int HEALTH_SAMPLE = 100;

    private final AuditLogStorage storage;
    private final AuditEntryValidator validator;
    private final ChainHasher hasher;
    private final ChainVerifier verifier;
    private final HashAlgorithm algorithm;
    private final int maxAppendRetries;
    private final ConcurrentHashMap<String, Consumer<AuditLogEntry>> subscribers = new ConcurrentHashMap<>();

    public AuditLogService(AuditLogStorage storage,
                           AuditEntryValidator validator,
                           ChainHasher hasher,
                           ChainVerifier verifier,
                           PolicyLedgerProperties properties) {
        this.storage = storage;
        this.validator = validator;
        this.hasher = hasher;
        this.verifier = verifier;
        this.algorithm = properties.getAudit().getHashAlgorithm();
        this.maxAppendRetries = Math.max(1, properties.getAudit().getMaxAppendRetries());
    }

    public AuditLogEntry append(String tenantId, AuditEntryInput input) {
        validator.validate(tenantId, input);

        for (int attempt = 1; ; attempt++) {
            AuditLogMetadata head = storage.getOrCreateLog(tenantId);
            if (head.sealed()) {
                throw new SealedLogException(tenantId, head.logId());
            }
            AuditLogEntry entry = stamp(tenantId, input, head);
            try {
                storage.appendIfHead(entry, head.latestSequence(), head.headHash());
            } catch (ConcurrentAppendException ex) {
                if (attempt >= maxAppendRetries) {
                    log.warn("Giving up append for tenant={} after {} attempts", tenantId, attempt);
                    throw new ConcurrentAppendException("Append for tenant " + tenantId
                        + " lost the head race " + attempt + " times: " + ex.getMessage());
                }
                log.warn("Append conflict for tenant={} at sequence={}, retrying (attempt {})",
                    tenantId, entry.chain().sequence(), attempt);
                Thread.yield();
                continue;
            }

            log.debug("Appended audit entry id={} tenant={} sequence={} action={}",
                entry.id(), tenantId, entry.chain().sequence(), entry.action().type());
            if (entry.highRisk()) {
                log.info("High-risk action recorded: tenant={} action={} actor={} outcome={}",
                    tenantId, entry.action().type(), entry.actor().id(), entry.outcome().status().getValue());
            }
            notifySubscribers(entry);
            return entry;
        }
    }

    /**
     * Appends the inputs in order and returns them with the Merkle root of their
     * content hashes. Entries already appended stay in the log if a later one fails.
     */
    public BatchAppendResult appendBatch(String tenantId, List<AuditEntryInput> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            return new BatchAppendResult(List.of(), null);
        }
        List<AuditLogEntry> appended = new ArrayList<>(inputs.size());
        for (AuditEntryInput input : inputs) {
            appended.add(append(tenantId, input));
        }
        List<String> leaves = appended.stream().map(e -> e.chain().contentHash()).toList();
        String root = MerkleTree.build(hasher, algorithm, leaves).rootHash();
        return new BatchAppendResult(appended, root);
    }

    public AuditQueryResult query(AuditQuery query) {
        validator.validate(query);
        AuditQueryResult result = storage.query(query);
        if (query.includeChainVerification()) {
            result = result.withChainVerification(verifier.verifySubsequence(result.entries()));
        }
        return result;
    }

    public AuditLogEntry getEntry(String tenantId, String entryId) {
        return storage.getEntry(tenantId, entryId)
            .orElseThrow(() -> new NotFoundException("Audit entry " + entryId + " not found for tenant " + tenantId));
    }

    public AuditLogEntry getEntryBySequence(String tenantId, long sequence) {
        return storage.getEntryBySequence(tenantId, sequence)
            .orElseThrow(() -> new NotFoundException("No audit entry at sequence " + sequence + " for tenant " + tenantId));
    }

    public AuditLogMetadata metadata(String tenantId) {
        return storage.getMetadata(tenantId)
            .orElseThrow(() -> new NotFoundException("No audit log for tenant " + tenantId));
    }

    public ChainVerificationResult verifyIntegrity(String tenantId) {
        return verifyIntegrity(tenantId, null, null);
    }

    /**
     * Strict verification of a sequence range, seeded with the hash of the entry
     * just before the range. Verifying to the head also checks that the last entry
     * is the one the log metadata points at.
     */
    public ChainVerificationResult verifyIntegrity(String tenantId, Long fromSequence, Long toSequence) {
        AuditLogMetadata head = metadata(tenantId);
        if (head.latestSequence() < 0) {
            return verifier.verify(List.of());
        }
        long from = fromSequence == null ? 0 : Math.max(0, fromSequence);
        long to = toSequence == null ? head.latestSequence() : Math.min(toSequence, head.latestSequence());

        List<AuditLogEntry> entries = storage.getEntries(tenantId, from, to);
        String expectedPrevHash = from == 0
            ? null
            : storage.getEntryBySequence(tenantId, from - 1).map(e -> e.chain().contentHash()).orElse(null);

        ChainVerificationResult result = verifier.verify(entries, expectedPrevHash);
        if (result.valid() && to == head.latestSequence() && !entries.isEmpty()) {
            AuditLogEntry last = entries.get(entries.size() - 1);
            if (!Objects.equals(last.chain().contentHash(), head.headHash())) {
                result = ChainVerificationResult.failed(result.entriesVerified(), last.chain().sequence(),
                    last.id(), "Head hash does not match last entry", 0, result.details(), result.durationMs());
            }
        }
        if (!result.valid()) {
            log.warn("Audit chain verification failed for log={} at sequence={}: {}",
                head.logId(), result.firstInvalidSequence(), result.error());
        }
        return result;
    }

    /**
     * Full integrity report over a sequence range: every issue with its severity,
     * plus gap, algorithm and time-range figures. A tenant without a log gets an
     * empty, valid report.
     */
    public VerificationReport verifyReport(String tenantId, VerificationOptions options) {
        VerificationOptions opts = options == null ? VerificationOptions.defaults() : options;
        AuditLogMetadata head = storage.getMetadata(tenantId).orElse(null);
        if (head == null || head.latestSequence() < 0) {
            return VerificationReport.empty(tenantId, 0);
        }
        long from = opts.startSequence() == null ? 0 : Math.max(0, opts.startSequence());
        long to = opts.endSequence() == null
            ? head.latestSequence()
            : Math.min(opts.endSequence(), head.latestSequence());
        if (opts.maxEntries() != null && opts.maxEntries() > 0) {
            to = Math.min(to, from + opts.maxEntries() - 1);
        }
        if (to < from) {
            return VerificationReport.empty(tenantId, 0);
        }

        List<AuditLogEntry> entries = storage.getEntries(tenantId, from, to);
        String anchorHash = from == 0
            ? null
            : storage.getEntryBySequence(tenantId, from - 1).map(e -> e.chain().contentHash()).orElse(null);
        VerificationReport report = verifier.inspect(tenantId, entries, from, anchorHash, opts);
        if (!report.valid()) {
            log.warn("Integrity report for log={} found {} issue(s): {}",
                head.logId(), report.issues().size(), report.summary());
        }
        return report;
    }

    /**
     * Health figures from the log metadata and the first entries, without
     * recomputing any hash.
     */
    public ChainHealthStats chainHealth(String tenantId) {
        AuditLogMetadata head = metadata(tenantId);
        if (head.latestSequence() < 0) {
            return ChainHealthStats.empty();
        }
        long sampleEnd = Math.min(HEALTH_SAMPLE - 1, head.latestSequence());
        List<HashAlgorithm> algorithms = storage.getEntries(tenantId, 0, sampleEnd).stream()
            .map(e -> e.chain().algorithm())
            .filter(Objects::nonNull)
            .distinct()
            .toList();
        long expected = head.latestSequence() + 1;
        long missing = Math.max(0, expected - head.entryCount());
        int continuity = (int) Math.round(head.entryCount() * 100.0 / expected);
        ChainHealthStats.TimeRange timeRange = head.latestTimestamp() == null
            ? null
            : new ChainHealthStats.TimeRange(head.createdAt(), head.latestTimestamp());
        return new ChainHealthStats(head.entryCount(), 0, 0, head.latestSequence(), timeRange,
            missing, missing, algorithms, continuity);
    }

    /**
     * @throws ChainIntegrityException if the tenant's chain does not verify
     */
    public ChainVerificationResult assertIntegrity(String tenantId) {
        ChainVerificationResult result = verifyIntegrity(tenantId);
        if (!result.valid()) {
            throw new ChainIntegrityException(metadata(tenantId).logId(), result);
        }
        return result;
    }

    public AuditLogMetadata seal(String tenantId, String reason) {
        AuditLogMetadata sealed = storage.seal(tenantId, reason);
        log.info("Sealed audit log={} tenant={} at sequence={} reason={}",
            sealed.logId(), tenantId, sealed.latestSequence(), reason);
        return sealed;
    }

    public String subscribe(Consumer<AuditLogEntry> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    private AuditLogEntry stamp(String tenantId, AuditEntryInput input, AuditLogMetadata head) {
        Instant now = Instant.now();
        Instant timestamp = (input.timestamp() != null ? input.timestamp() : now).truncatedTo(ChronoUnit.MILLIS);
        long sequence = head.nextSequence();
        String id = "alog-" + now.toEpochMilli() + "-" + sequence + "-" + randomSuffix(6);

        AuditLogEntry.Context context = input.context() == null
            ? AuditLogEntry.Context.ofTenant(tenantId)
            : input.context().withTenantId(tenantId);
        boolean highRisk = Boolean.TRUE.equals(input.highRisk())
            || input.action().sensitive()
            || HighRiskActions.isHighRisk(input.action().type());

        AuditLogEntry.ChainLink pending = new AuditLogEntry.ChainLink(sequence, head.headHash(), null, algorithm, now);
        AuditLogEntry draft = new AuditLogEntry(id, AuditLogEntry.SCHEMA_VERSION, timestamp,
            input.actor(), input.action(), input.resource(), input.outcome(), context, pending,
            input.tags(), highRisk, input.compliance(), input.details());

        String contentHash = hasher.computeContentHash(draft, algorithm);
        AuditLogEntry.ChainLink link = new AuditLogEntry.ChainLink(sequence, head.headHash(), contentHash, algorithm, now);
        return new AuditLogEntry(draft.id(), draft.schemaVersion(), draft.timestamp(), draft.actor(),
            draft.action(), draft.resource(), draft.outcome(), draft.context(), link, draft.tags(),
            draft.highRisk(), draft.compliance(), draft.details());
    }

    private static String randomSuffix(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }

    private void notifySubscribers(AuditLogEntry entry) {
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(entry);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for entry={}: {}", entry.id(), ex.getMessage());
            }
        });
    }

    public record BatchAppendResult(List<AuditLogEntry> entries, String merkleRoot) {}
}
