package com.policyledger.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ComplianceFramework {
    SOC2("soc2"),
    GDPR("gdpr"),
    HIPAA("hipaa"),
    PCI("pci"),
    ISO27001("iso27001"),
    FEDRAMP("fedramp");

    private final String value;

    ComplianceFramework(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComplianceFramework fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown compliance framework: " + raw));
    }
}
