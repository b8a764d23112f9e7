package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Decision produced by a matching rule.
 */
public enum Effect {
    ALLOW("allow"),
    DENY("deny"),
    REQUIRE_APPROVAL("require_approval"),
    WARN("warn"),
    LOG_ONLY("log_only");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Effects that let the action proceed without further steps. */
    public boolean isPermissive() {
        return this == ALLOW || this == WARN || this == LOG_ONLY;
    }

    @JsonCreator
    public static Effect fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown effect: " + raw));
    }
}
