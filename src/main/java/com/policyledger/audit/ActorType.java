package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ActorType {
    USER("user"),
    AGENT("agent"),
    SERVICE("service"),
    SYSTEM("system"),
    WEBHOOK("webhook"),
    SCHEDULER("scheduler"),
    API_KEY("api_key");

    private final String value;

    ActorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ActorType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown actor type: " + raw));
    }
}
