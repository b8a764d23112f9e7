package com.policyledger.audit;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Filter, paging and ordering options for reading one tenant's audit log.
 * Unset filters match everything; set filters are combined with AND, and the
 * values inside one set filter with OR.
 */
public record AuditQuery(
    String tenantId,
    Set<ActionCategory> categories,
    Set<String> actionTypes,
    Set<OutcomeStatus> outcomes,
    String actorId,
    ActorType actorType,
    ResourceType resourceType,
    String resourceId,
    String traceId,
    String runId,
    String requestId,
    Instant startTime,
    Instant endTime,
    Long startSequence,
    Long endSequence,
    boolean highRiskOnly,
    Set<String> tags,
    String searchText,
    int limit,
    int offset,
    SortOrder order,
    boolean includeChainVerification
) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
        actionTypes = actionTypes == null ? Set.of() : Set.copyOf(actionTypes);
        outcomes = outcomes == null ? Set.of() : Set.copyOf(outcomes);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        order = order == null ? SortOrder.DESC : order;
    }

    public static Builder forTenant(String tenantId) {
        return new Builder(tenantId);
    }

    /** True when the entry satisfies every filter; paging is not considered. */
    public boolean matches(AuditLogEntry entry) {
        AuditLogEntry.Context context = entry.context();
        if (tenantId != null && !tenantId.equals(entry.tenantId())) {
            return false;
        }
        if (!categories.isEmpty() && !categories.contains(entry.action().category())) {
            return false;
        }
        if (!actionTypes.isEmpty() && !actionTypes.contains(entry.action().type())) {
            return false;
        }
        if (!outcomes.isEmpty() && !outcomes.contains(entry.outcome().status())) {
            return false;
        }
        if (actorId != null && !actorId.equals(entry.actor().id())) {
            return false;
        }
        if (actorType != null && actorType != entry.actor().type()) {
            return false;
        }
        if (resourceType != null && (entry.resource() == null || resourceType != entry.resource().type())) {
            return false;
        }
        if (resourceId != null && (entry.resource() == null || !resourceId.equals(entry.resource().id()))) {
            return false;
        }
        if (traceId != null && (context == null || !traceId.equals(context.traceId()))) {
            return false;
        }
        if (runId != null && (context == null || !runId.equals(context.runId()))) {
            return false;
        }
        if (requestId != null && (context == null || !requestId.equals(context.requestId()))) {
            return false;
        }
        if (startTime != null && entry.timestamp().isBefore(startTime)) {
            return false;
        }
        if (endTime != null && entry.timestamp().isAfter(endTime)) {
            return false;
        }
        long sequence = entry.chain().sequence();
        if (startSequence != null && sequence < startSequence) {
            return false;
        }
        if (endSequence != null && sequence > endSequence) {
            return false;
        }
        if (highRiskOnly && !entry.highRisk()) {
            return false;
        }
        if (!tags.isEmpty() && entry.tags().stream().noneMatch(tags::contains)) {
            return false;
        }
        return searchText == null || searchText.isBlank() || detailsContain(entry.details(), searchText);
    }

    private static boolean detailsContain(Map<String, Object> details, String text) {
        String needle = text.toLowerCase();
        return details.values().stream()
            .anyMatch(v -> v != null && String.valueOf(v).toLowerCase().contains(needle));
    }

    public static final class Builder {
        private final String tenantId;
        private final Set<ActionCategory> categories = new LinkedHashSet<>();
        private final Set<String> actionTypes = new LinkedHashSet<>();
        private final Set<OutcomeStatus> outcomes = new LinkedHashSet<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private String actorId;
        private ActorType actorType;
        private ResourceType resourceType;
        private String resourceId;
        private String traceId;
        private String runId;
        private String requestId;
        private Instant startTime;
        private Instant endTime;
        private Long startSequence;
        private Long endSequence;
        private boolean highRiskOnly;
        private String searchText;
        private int limit = DEFAULT_LIMIT;
        private int offset;
        private SortOrder order = SortOrder.DESC;
        private boolean includeChainVerification;

        private Builder(String tenantId) {
            this.tenantId = tenantId;
        }

        public Builder categories(Collection<ActionCategory> values) {
            categories.addAll(values);
            return this;
        }

        public Builder category(ActionCategory value) {
            categories.add(value);
            return this;
        }

        public Builder actionTypes(Collection<String> values) {
            actionTypes.addAll(values);
            return this;
        }

        public Builder outcomes(Collection<OutcomeStatus> values) {
            outcomes.addAll(values);
            return this;
        }

        public Builder tags(Collection<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder tag(String value) {
            tags.add(value);
            return this;
        }

        public Builder actorId(String value) {
            this.actorId = value;
            return this;
        }

        public Builder actorType(ActorType value) {
            this.actorType = value;
            return this;
        }

        public Builder resourceType(ResourceType value) {
            this.resourceType = value;
            return this;
        }

        public Builder resourceId(String value) {
            this.resourceId = value;
            return this;
        }

        public Builder traceId(String value) {
            this.traceId = value;
            return this;
        }

        public Builder runId(String value) {
            this.runId = value;
            return this;
        }

        public Builder requestId(String value) {
            this.requestId = value;
            return this;
        }

        public Builder timeRange(Instant start, Instant end) {
            this.startTime = start;
            this.endTime = end;
            return this;
        }

        public Builder sequenceRange(Long start, Long end) {
            this.startSequence = start;
            this.endSequence = end;
            return this;
        }

        public Builder highRiskOnly(boolean value) {
            this.highRiskOnly = value;
            return this;
        }

        public Builder searchText(String value) {
            this.searchText = value;
            return this;
        }

        public Builder limit(int value) {
            this.limit = value;
            return this;
        }

        public Builder offset(int value) {
            this.offset = value;
            return this;
        }

        public Builder order(SortOrder value) {
            this.order = value;
            return this;
        }

        public Builder includeChainVerification(boolean value) {
            this.includeChainVerification = value;
            return this;
        }

        public AuditQuery build() {
            return new AuditQuery(tenantId, categories, actionTypes, outcomes, actorId, actorType,
                resourceType, resourceId, traceId, runId, requestId, startTime, endTime,
                startSequence, endSequence, highRiskOnly, tags, searchText, limit, offset, order,
                includeChainVerification);
        }
    }
}
