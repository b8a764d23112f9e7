package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of {@link PolicyCondition}. {@link #UNKNOWN} stands for any type
 * name the service does not recognize.
 */
public enum ConditionType {
    COMPLEXITY("complexity"),
    FILE_PATTERN("file_pattern"),
    AUTHOR("author"),
    TIME_WINDOW("time_window"),
    REPOSITORY("repository"),
    BRANCH("branch"),
    LABEL("label"),
    AGENT("agent"),
    CUSTOM("custom"),
    UNKNOWN("unknown");

    private final String value;

    ConditionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
