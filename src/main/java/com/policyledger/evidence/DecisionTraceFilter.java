package com.policyledger.evidence;

import com.policyledger.audit.AgentType;

import java.time.Instant;

/** Unset fields match everything. */
public record DecisionTraceFilter(
    String tenantId,
    String runId,
    AgentType agentType,
    Instant startTime,
    Instant endTime,
    Integer limit
) {

    public boolean matches(DecisionTrace trace) {
        return (tenantId == null || tenantId.equals(trace.tenantId()))
            && (runId == null || runId.equals(trace.runId()))
            && (agentType == null || agentType == trace.agentType())
            && (startTime == null || !trace.timestamp().isBefore(startTime))
            && (endTime == null || !trace.timestamp().isAfter(endTime));
    }
}
