package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** How a child document combines with the rules it inherits. */
public enum InheritanceMode {
    REPLACE("replace"),
    EXTEND("extend"),
    OVERRIDE("override");

    private final String value;

    InheritanceMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InheritanceMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown inheritance mode: " + raw));
    }
}
