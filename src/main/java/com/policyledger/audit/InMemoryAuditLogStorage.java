package com.policyledger.audit;

import com.policyledger.api.NotFoundException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryAuditLogStorage implements AuditLogStorage {

    static final String TENANT_SCOPE = "tenant";

    private final ConcurrentHashMap<String, TenantLog> logs = new ConcurrentHashMap<>();

    @Override
    public AuditLogMetadata getOrCreateLog(String tenantId) {
        return logs.computeIfAbsent(tenantId, this::newLog).metadata;
    }

    @Override
    public Optional<AuditLogMetadata> getMetadata(String tenantId) {
        TenantLog log = logs.get(tenantId);
        return log == null ? Optional.empty() : Optional.of(log.metadata);
    }

    @Override
    public void appendIfHead(AuditLogEntry entry, long expectedSequence, String expectedHeadHash) {
        TenantLog log = logs.computeIfAbsent(entry.tenantId(), this::newLog);
        synchronized (log) {
            AuditLogMetadata head = log.metadata;
            if (head.sealed()) {
                throw new SealedLogException(head.tenantId(), head.logId());
            }
            if (head.latestSequence() != expectedSequence || !Objects.equals(head.headHash(), expectedHeadHash)) {
                throw new ConcurrentAppendException("Log " + head.logId() + " head moved to sequence "
                    + head.latestSequence() + " (expected " + expectedSequence + ")");
            }
            if (entry.chain().sequence() != expectedSequence + 1) {
                throw new IllegalArgumentException("Entry sequence " + entry.chain().sequence()
                    + " does not follow head " + expectedSequence);
            }
            log.entries.add(entry);
            log.metadata = head.advance(entry);
        }
    }

    @Override
    public AuditQueryResult query(AuditQuery query) {
        long started = System.currentTimeMillis();
        TenantLog log = logs.get(query.tenantId());
        if (log == null) {
            return new AuditQueryResult(List.of(), 0, false, 0, null);
        }

        List<AuditLogEntry> matching = log.entries.stream()
            .filter(query::matches)
            .collect(Collectors.toCollection(ArrayList::new));

        Comparator<AuditLogEntry> bySequence = Comparator.comparingLong(e -> e.chain().sequence());
        matching.sort(query.order() == SortOrder.ASC ? bySequence : bySequence.reversed());

        int total = matching.size();
        int from = Math.min(Math.max(query.offset(), 0), total);
        int to = Math.min(from + Math.max(query.limit(), 0), total);
        List<AuditLogEntry> page = matching.subList(from, to);
        return new AuditQueryResult(page, total, to < total, System.currentTimeMillis() - started, null);
    }

    @Override
    public Optional<AuditLogEntry> getEntry(String tenantId, String entryId) {
        TenantLog log = logs.get(tenantId);
        if (log == null) {
            return Optional.empty();
        }
        return log.entries.stream().filter(e -> e.id().equals(entryId)).findFirst();
    }

    @Override
    public Optional<AuditLogEntry> getEntryBySequence(String tenantId, long sequence) {
        TenantLog log = logs.get(tenantId);
        if (log == null || sequence < 0 || sequence >= log.entries.size()) {
            return Optional.empty();
        }
        // entries are stored at the index equal to their sequence
        return Optional.of(log.entries.get((int) sequence));
    }

    @Override
    public List<AuditLogEntry> getEntries(String tenantId, long fromSequence, long toSequence) {
        TenantLog log = logs.get(tenantId);
        if (log == null || toSequence < fromSequence) {
            return List.of();
        }
        return log.entries.stream()
            .filter(e -> e.chain().sequence() >= fromSequence && e.chain().sequence() <= toSequence)
            .toList();
    }

    @Override
    public AuditLogMetadata seal(String tenantId, String reason) {
        TenantLog log = logs.get(tenantId);
        if (log == null) {
            throw new NotFoundException("No audit log for tenant " + tenantId);
        }
        synchronized (log) {
            if (log.metadata.sealed()) {
                throw new SealedLogException(tenantId, log.metadata.logId());
            }
            log.metadata = log.metadata.seal(reason, Instant.now());
            return log.metadata;
        }
    }

    private TenantLog newLog(String tenantId) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String logId = "log-" + tenantId + "-" + TENANT_SCOPE + "-" + suffix;
        return new TenantLog(AuditLogMetadata.empty(logId, tenantId, TENANT_SCOPE, Instant.now()));
    }

    private static final class TenantLog {
        private final CopyOnWriteArrayList<AuditLogEntry> entries = new CopyOnWriteArrayList<>();
        private volatile AuditLogMetadata metadata;

        private TenantLog(AuditLogMetadata metadata) {
            this.metadata = metadata;
        }
    }
}
