package com.policyledger.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Caller-supplied part of an audit entry. Identity, sequence and chain fields
 * are assigned on append. {@code highRisk} may be requested but is also forced
 * on for well-known dangerous action types.
 */
public record AuditEntryInput(
    Instant timestamp,
    AuditLogEntry.Actor actor,
    AuditLogEntry.Action action,
    AuditLogEntry.Resource resource,
    AuditLogEntry.Outcome outcome,
    AuditLogEntry.Context context,
    List<String> tags,
    Boolean highRisk,
    List<ComplianceFramework> compliance,
    Map<String, Object> details
) {

    public static AuditEntryInput of(AuditLogEntry.Actor actor,
                                     AuditLogEntry.Action action,
                                     AuditLogEntry.Outcome outcome) {
        return new AuditEntryInput(null, actor, action, null, outcome, null, null, null, null, null);
    }

    public AuditEntryInput withResource(AuditLogEntry.Resource value) {
        return new AuditEntryInput(timestamp, actor, action, value, outcome, context, tags, highRisk, compliance, details);
    }

    public AuditEntryInput withContext(AuditLogEntry.Context value) {
        return new AuditEntryInput(timestamp, actor, action, resource, outcome, value, tags, highRisk, compliance, details);
    }

    public AuditEntryInput withTags(List<String> value) {
        return new AuditEntryInput(timestamp, actor, action, resource, outcome, context, value, highRisk, compliance, details);
    }

    public AuditEntryInput withTimestamp(Instant value) {
        return new AuditEntryInput(value, actor, action, resource, outcome, context, tags, highRisk, compliance, details);
    }

    public AuditEntryInput withDetails(Map<String, Object> value) {
        return new AuditEntryInput(timestamp, actor, action, resource, outcome, context, tags, highRisk, compliance, value);
    }

    public AuditEntryInput withCompliance(List<ComplianceFramework> value) {
        return new AuditEntryInput(timestamp, actor, action, resource, outcome, context, tags, highRisk, value, details);
    }
}
