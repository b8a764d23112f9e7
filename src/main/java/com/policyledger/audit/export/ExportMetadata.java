package com.policyledger.audit.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ResourceType;

import java.time.Instant;

/** Describes an export: who, when, which filters, and what range it covers. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportMetadata(
    Instant exportedAt,
    ExportFormat format,
    String tenantId,
    Filters filters,
    int entryCount,
    SequenceRange sequenceRange,
    TimeRange timeRange,
    String exportVersion,
    String schemaVersion
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Filters(
        Instant startTime,
        Instant endTime,
        Long startSequence,
        Long endSequence,
        String actorId,
        ActionCategory actionCategory,
        ResourceType resourceType,
        Boolean highRiskOnly
    ) {}

    /** {@code end} is -1 for an empty export. */
    public record SequenceRange(long start, long end) {}

    public record TimeRange(Instant start, Instant end) {}
}
