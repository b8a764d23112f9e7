package com.policyledger.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.ResourceType;

import java.time.Instant;
import java.util.List;

/**
 * What to collect: a tenant, a window and optionally a control id or control
 * category that narrows the audit categories searched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceQuery(
    String tenantId,
    Instant startTime,
    Instant endTime,
    String controlId,
    String controlCategory,
    List<ActionCategory> actionCategories,
    ResourceType resourceType,
    ActorType actorType,
    boolean highRiskOnly,
    Integer maxPerSource,
    Boolean verifyChain
) {

    public EvidenceQuery {
        actionCategories = actionCategories == null ? List.of() : List.copyOf(actionCategories);
    }

    public static EvidenceQuery forControl(String tenantId, String controlId, Instant start, Instant end) {
        return new EvidenceQuery(tenantId, start, end, controlId, null, null, null, null, false, null, null);
    }

    public static EvidenceQuery forWindow(String tenantId, Instant start, Instant end) {
        return new EvidenceQuery(tenantId, start, end, null, null, null, null, null, false, null, null);
    }

    public EvidenceQuery withControlCategory(String category) {
        return new EvidenceQuery(tenantId, startTime, endTime, controlId, category, actionCategories,
            resourceType, actorType, highRiskOnly, maxPerSource, verifyChain);
    }

    /** Fills in unset limits and verification flags. */
    EvidenceQuery withDefaults(int defaultMaxPerSource, boolean defaultVerifyChain) {
        return new EvidenceQuery(tenantId, startTime, endTime, controlId, controlCategory, actionCategories,
            resourceType, actorType, highRiskOnly,
            maxPerSource != null ? maxPerSource : defaultMaxPerSource,
            verifyChain != null ? verifyChain : defaultVerifyChain);
    }
}
