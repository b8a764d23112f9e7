package com.policyledger.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Citation of audit entries (or decision traces) in support of a control.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvidenceReference(
    String id,
    String type,
    String description,
    List<String> auditLogEntryIds,
    boolean chainVerified,
    Instant verifiedAt,
    Instant collectedAt,
    String collectedBy,
    Map<String, Object> metadata
) {

    public EvidenceReference {
        auditLogEntryIds = auditLogEntryIds == null ? List.of() : List.copyOf(auditLogEntryIds);
        metadata = metadata == null ? Map.of() : metadata;
    }
}
