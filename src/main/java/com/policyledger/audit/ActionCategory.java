package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Top-level grouping of audited actions; the first segment of an action type usually repeats it. */
public enum ActionCategory {
    POLICY("policy"),
    AUTH("auth"),
    DATA("data"),
    GIT("git"),
    AGENT("agent"),
    APPROVAL("approval"),
    CONFIG("config"),
    ADMIN("admin"),
    SECURITY("security"),
    BILLING("billing");

    private final String value;

    ActionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActionCategory fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown action category: " + raw));
    }
}
