package com.policyledger.evidence;

import com.policyledger.audit.AgentType;
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

/**
 * Agent decision traces as evidence. Traces are not hash chained, so they are
 * never reported as verified.
 */
@Component
public class DecisionTraceEvidenceSource implements EvidenceSource {

    private static final Logger log = LoggerFactory.getLogger(DecisionTraceEvidenceSource.class);

    private static final int DEFAULT_LIMIT = 50;

    private final DecisionTraceStore store;
    private final String collectorId;

    public DecisionTraceEvidenceSource(DecisionTraceStore store, PolicyLedgerProperties properties) {
        this.store = store;
        this.collectorId = properties.getEvidence().getCollectorId();
    }

    @Override
    public EvidenceSourceType type() {
        return EvidenceSourceType.DECISION_TRACE;
    }

    @Override
    public boolean isAvailable() {
        try {
            store.query(new DecisionTraceFilter(null, null, null, null, null, 1));
            return true;
        } catch (RuntimeException ex) {
            log.warn("Decision trace store unavailable: {}", ex.getMessage());
            return false;
        }
    }

    @Override
    public List<CollectedEvidence> collect(EvidenceQuery query) {
        int limit = query.maxPerSource() == null ? DEFAULT_LIMIT : query.maxPerSource();
        List<CollectedEvidence> result = new ArrayList<>();
        for (AgentType agentType : agentTypesFor(query.controlCategory())) {
            try {
                List<DecisionTrace> traces = store.query(new DecisionTraceFilter(query.tenantId(), null,
                    agentType, query.startTime(), query.endTime(), limit));
                for (DecisionTrace trace : traces) {
                    result.add(toEvidence(trace, query));
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to read decision traces for agent {}: {}", agentType.getValue(), ex.getMessage());
            }
        }
        return result;
    }

    static List<AgentType> agentTypesFor(String controlCategory) {
        if (controlCategory == null) {
            return List.of(AgentType.values());
        }
        return switch (ControlMappings.normalizeCategory(controlCategory)) {
            case "change_management" -> List.of(AgentType.CODER, AgentType.RESOLVER, AgentType.REVIEWER);
            case "risk_assessment" -> List.of(AgentType.TRIAGE, AgentType.REVIEWER);
            default -> List.of(AgentType.values());
        };
    }

    private CollectedEvidence toEvidence(DecisionTrace trace, EvidenceQuery query) {
        DecisionTrace.Outcome outcome = trace.outcome();
        boolean overridden = outcome != null && outcome.humanOverride() != null;
        String description = trace.agentType().getValue() + " agent: " + trace.decision().action()
            + " (confidence: " + Math.round(trace.decision().confidence() * 100) + "%)"
            + (overridden ? " [overridden]" : "");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("runId", trace.runId());
        metadata.put("agentType", trace.agentType().getValue());
        metadata.put("reasoning", trace.decision().reasoning());
        metadata.put("confidence", trace.decision().confidence());
        metadata.put("alternatives", trace.decision().alternatives());
        if (outcome != null) {
            metadata.put("outcome", outcome.result());
            if (overridden) {
                metadata.put("humanOverride", outcome.humanOverride());
            }
        }

        EvidenceReference reference = new EvidenceReference("dt-" + trace.id(),
            EvidenceSourceType.DECISION_TRACE.getValue(), description, List.of(trace.id()), false, null,
            Instant.now(), collectorId, metadata);
        return new CollectedEvidence(reference, EvidenceSourceType.DECISION_TRACE, relevance(trace),
            relatedControls(trace, query), null);
    }

    static double relevance(DecisionTrace trace) {
        double score = 0.6;
        if (trace.decision().confidence() > 0.9) {
            score += 0.1;
        }
        DecisionTrace.Outcome outcome = trace.outcome();
        if (outcome != null && outcome.humanOverride() != null) {
            score += 0.2;
        }
        if (outcome != null && outcome.result() == DecisionTrace.Result.FAILURE) {
            score += 0.1;
        }
        return Math.min(1.0, score);
    }

    private static List<String> relatedControls(DecisionTrace trace, EvidenceQuery query) {
        Set<String> controls = new LinkedHashSet<>();
        if (query.controlId() != null) {
            controls.add(query.controlId());
        }
        switch (trace.agentType()) {
            case CODER, RESOLVER -> controls.addAll(List.of("CC8.1", "CC5.2"));
            case TRIAGE -> controls.addAll(List.of("CC3.2", "CC3.3"));
            case REVIEWER -> controls.addAll(List.of("CC7.1", "CC7.4"));
            default -> {
                // orchestrator decisions are not tied to a specific control
            }
        }
        return List.copyOf(controls);
    }
}
