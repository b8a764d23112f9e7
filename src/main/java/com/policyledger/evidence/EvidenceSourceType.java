package com.policyledger.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EvidenceSourceType {
    AUDIT_LOG("audit_log"),
    DECISION_TRACE("decision_trace"),
    POLICY_EVALUATION("policy_evaluation"),
    DOCUMENT("document");

    private final String value;

    EvidenceSourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EvidenceSourceType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown evidence source: " + raw));
    }
}
