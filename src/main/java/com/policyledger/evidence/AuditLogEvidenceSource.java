package com.policyledger.evidence;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.AuditQuery;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.SortOrder;
import com.policyledger.chain.ChainVerificationResult;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.config.PolicyLedgerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reads audit entries in the categories mapped to the queried control, plus
 * entries tagged with the control id itself.
 *
 * The verification attached to each item covers only the retrieved entries: it
 * proves they are consistent with each other, not that nothing was removed
 * between them. Full-log checks go through {@link AuditLogService#verifyIntegrity}.
 */
@Component
public class AuditLogEvidenceSource implements EvidenceSource {

    private static final Logger log = LoggerFactory.getLogger(AuditLogEvidenceSource.class);

    private final AuditLogService auditLogService;
    private final ChainVerifier verifier;
    private final String collectorId;

    public AuditLogEvidenceSource(AuditLogService auditLogService, ChainVerifier verifier,
                                  PolicyLedgerProperties properties) {
        this.auditLogService = auditLogService;
        this.verifier = verifier;
        this.collectorId = properties.getEvidence().getCollectorId();
    }

    @Override
    public EvidenceSourceType type() {
        return EvidenceSourceType.AUDIT_LOG;
    }

    @Override
    public List<CollectedEvidence> collect(EvidenceQuery query) {
        Map<String, AuditLogEntry> entries = new LinkedHashMap<>();
        for (ActionCategory category : ControlMappings.resolveCategories(query)) {
            read(baseQuery(query).category(category), "category " + category.getValue(), entries);
        }
        if (query.controlId() != null) {
            read(baseQuery(query).tag(query.controlId()), "tag " + query.controlId(), entries);
        }
        if (entries.isEmpty()) {
            return List.of();
        }

        ChainVerificationResult verification = null;
        if (Boolean.TRUE.equals(query.verifyChain())) {
            verification = verifier.verifySubsequence(new ArrayList<>(entries.values()));
            if (!verification.valid()) {
                log.warn("Evidence window for tenant={} failed verification at sequence={}: {}",
                    query.tenantId(), verification.firstInvalidSequence(), verification.error());
            }
        }

        List<CollectedEvidence> result = new ArrayList<>(entries.size());
        for (AuditLogEntry entry : entries.values()) {
            result.add(toEvidence(entry, query, verification));
        }
        return result;
    }

    private AuditQuery.Builder baseQuery(EvidenceQuery query) {
        int limit = query.maxPerSource() == null ? AuditQuery.DEFAULT_LIMIT : query.maxPerSource();
        return AuditQuery.forTenant(query.tenantId())
            .timeRange(query.startTime(), query.endTime())
            .highRiskOnly(query.highRiskOnly())
            .actorType(query.actorType())
            .resourceType(query.resourceType())
            .limit(Math.min(limit, AuditQuery.MAX_LIMIT))
            .order(SortOrder.DESC);
    }

    private void read(AuditQuery.Builder builder, String what, Map<String, AuditLogEntry> into) {
        AuditQuery auditQuery = builder.build();
        try {
            for (AuditLogEntry entry : auditLogService.query(auditQuery).entries()) {
                into.putIfAbsent(entry.id(), entry);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to read audit log for {} (tenant={}): {}", what, auditQuery.tenantId(), ex.getMessage());
        }
    }

    private CollectedEvidence toEvidence(AuditLogEntry entry, EvidenceQuery query,
                                         ChainVerificationResult verification) {
        String description = entry.action().category().getValue() + ":" + entry.action().type()
            + " by " + entry.actor().type().getValue() + ":" + entry.actor().id()
            + (entry.outcome().status() != OutcomeStatus.SUCCESS ? " (" + entry.outcome().status().getValue() + ")" : "");
        boolean verified = verification != null && verification.valid();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sequence", entry.chain().sequence());
        metadata.put("actionType", entry.action().type());
        metadata.put("highRisk", entry.highRisk());

        EvidenceReference reference = new EvidenceReference(
            "ev-audit-" + entry.id() + "-" + UUID.randomUUID().toString().substring(0, 4),
            EvidenceSourceType.AUDIT_LOG.getValue(),
            description,
            List.of(entry.id()),
            verified,
            verified ? Instant.now() : null,
            Instant.now(),
            collectorId,
            metadata);

        return new CollectedEvidence(reference, EvidenceSourceType.AUDIT_LOG, relevance(entry, query),
            relatedControls(entry, query), verification);
    }

    static double relevance(AuditLogEntry entry, EvidenceQuery query) {
        ActionCategory category = entry.action().category();
        double score = 0.5;
        if (entry.action().sensitive()) {
            score += 0.2;
        }
        if (entry.outcome().status() == OutcomeStatus.FAILURE) {
            score += 0.1;
        }
        if (category == ActionCategory.POLICY || category == ActionCategory.APPROVAL) {
            score += 0.15;
        }
        if (category == ActionCategory.SECURITY) {
            score += 0.15;
        }
        if (query.controlId() != null && ControlMappings.forControl(query.controlId()).contains(category)) {
            score += 0.2;
        }
        return Math.min(1.0, score);
    }

    private static List<String> relatedControls(AuditLogEntry entry, EvidenceQuery query) {
        Set<String> controls = new LinkedHashSet<>();
        if (query.controlId() != null) {
            controls.add(query.controlId());
        }
        controls.addAll(ControlMappings.controlsFor(entry.action().category()));
        return List.copyOf(controls);
    }
}
