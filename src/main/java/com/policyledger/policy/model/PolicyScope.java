package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Inheritance level of a policy document, from broadest to narrowest. */
public enum PolicyScope {
    GLOBAL("global"),
    ORG("org"),
    REPO("repo"),
    BRANCH("branch");

    private final String value;

    PolicyScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PolicyScope fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown policy scope: " + raw));
    }
}
