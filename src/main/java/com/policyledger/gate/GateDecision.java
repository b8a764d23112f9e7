package com.policyledger.gate;

import com.policyledger.audit.AuditLogEntry;
import com.policyledger.policy.engine.EvaluationResult;

/** A policy decision together with the audit entry that records it. */
public record GateDecision(EvaluationResult decision, AuditLogEntry auditEntry) {

    public boolean allowed() {
        return decision.allowed();
    }
}
