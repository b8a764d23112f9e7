package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.chain.HashAlgorithm;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable record in a tenant's audit log.
 *
 * Written exactly once by the append path and never updated. The {@code chain}
 * block links the entry to its predecessor; every other field is covered by the
 * content hash.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLogEntry(
    String id,
    String schemaVersion,
    Instant timestamp,
    Actor actor,
    Action action,
    Resource resource,
    Outcome outcome,
    Context context,
    ChainLink chain,
    List<String> tags,
    boolean highRisk,
    List<ComplianceFramework> compliance,
    Map<String, Object> details
) {

    public static final String SCHEMA_VERSION = "1.0";

    public AuditLogEntry {
        tags = tags == null ? List.of() : List.copyOf(tags);
        compliance = compliance == null ? List.of() : List.copyOf(compliance);
        details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String tenantId() {
        return context == null ? null : context.tenantId();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Actor(
        ActorType type,
        String id,
        String displayName,
        AgentType agentType,
        OnBehalfOf onBehalfOf
    ) {
        public static Actor of(ActorType type, String id) {
            return new Actor(type, id, null, null, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OnBehalfOf(ActorType type, String id, String reason) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Action(
        ActionCategory category,
        String type,
        String description,
        boolean sensitive
    ) {
        public static Action of(ActionCategory category, String type) {
            return new Action(category, type, null, false);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Resource(
        ResourceType type,
        String id,
        String name,
        Map<String, Object> attributes
    ) {
        public static Resource of(ResourceType type, String id) {
            return new Resource(type, id, null, null);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Outcome(
        OutcomeStatus status,
        String errorCode,
        String errorMessage,
        Long durationMs
    ) {
        public static Outcome of(OutcomeStatus status) {
            return new Outcome(status, null, null, null);
        }
    }

    /** Correlation identifiers linking the entry to tenants, traces and runs. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Context(
        String tenantId,
        String orgId,
        String repoId,
        String traceId,
        String spanId,
        String requestId,
        String runId,
        String candidateId,
        String sessionId,
        String causationId,
        String environment,
        String service
    ) {
        public static Context ofTenant(String tenantId) {
            return new Context(tenantId, null, null, null, null, null, null, null, null, null, null, null);
        }

        public Context withTenantId(String tenant) {
            return new Context(tenant, orgId, repoId, traceId, spanId, requestId, runId,
                candidateId, sessionId, causationId, environment, service);
        }

        public Context withTraceId(String trace) {
            return new Context(tenantId, orgId, repoId, trace, spanId, requestId, runId,
                candidateId, sessionId, causationId, environment, service);
        }

        public Context withRunId(String run) {
            return new Context(tenantId, orgId, repoId, traceId, spanId, requestId, run,
                candidateId, sessionId, causationId, environment, service);
        }

        public Context withRequestId(String request) {
            return new Context(tenantId, orgId, repoId, traceId, spanId, request, runId,
                candidateId, sessionId, causationId, environment, service);
        }
    }

    /**
     * Link to the previous entry. {@code prevHash} is null only for sequence 0.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChainLink(
        long sequence,
        String prevHash,
        String contentHash,
        HashAlgorithm algorithm,
        Instant computedAt
    ) {}
}
