package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ResourceType {
    POLICY("policy"),
    POLICY_RULE("policy_rule"),
    REPOSITORY("repository"),
    BRANCH("branch"),
    PULL_REQUEST("pull_request"),
    COMMIT("commit"),
    RUN("run"),
    APPROVAL("approval"),
    TENANT("tenant"),
    USER("user"),
    AGENT("agent"),
    SECRET("secret"),
    API_KEY("api_key"),
    CONFIG("config"),
    ARTIFACT("artifact");

    private final String value;

    ResourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ResourceType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown resource type: " + raw));
    }
}
