package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AgentType {
    TRIAGE("triage"),
    CODER("coder"),
    RESOLVER("resolver"),
    REVIEWER("reviewer"),
    ORCHESTRATOR("orchestrator");

    private final String value;

    AgentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AgentType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown agent type: " + raw));
    }
}
