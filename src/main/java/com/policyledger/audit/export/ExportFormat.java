package com.policyledger.audit.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ExportFormat {
    JSON("json", "application/json", "json"),
    JSON_LINES("json-lines", "application/x-ndjson", "jsonl"),
    CSV("csv", "text/csv", "csv"),
    CEF("cef", "text/plain", "cef"),
    SYSLOG("syslog", "text/plain", "log");

    private final String value;
    private final String contentType;
    private final String extension;

    ExportFormat(String value, String contentType, String extension) {
        this.value = value;
        this.contentType = contentType;
        this.extension = extension;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    @JsonCreator
    public static ExportFormat fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown export format: " + raw));
    }
}
