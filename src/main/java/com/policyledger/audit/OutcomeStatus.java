package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum OutcomeStatus {
    SUCCESS("success"),
    FAILURE("failure"),
    DENIED("denied"),
    BLOCKED("blocked"),
    PENDING("pending"),
    PARTIAL("partial"),
    SKIPPED("skipped");

    private final String value;

    OutcomeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OutcomeStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown outcome status: " + raw));
    }
}
