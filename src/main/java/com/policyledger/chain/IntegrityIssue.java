package com.policyledger.chain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * One problem found while inspecting a chain.
 *
 * @param expected       expected value, where one applies
 * @param actual         value found
 * @param relatedEntries other entries involved, e.g. the duplicates of a sequence
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrityIssue(
    Type type,
    Severity severity,
    long sequence,
    String entryId,
    String message,
    String expected,
    String actual,
    List<String> relatedEntries
) {

    public static IntegrityIssue of(Type type, long sequence, String entryId, String message,
                                    String expected, String actual, List<String> relatedEntries) {
        return new IntegrityIssue(type, type.severity(), sequence, entryId, message, expected, actual,
            relatedEntries);
    }

    public enum Severity {
        CRITICAL("critical"),
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low");

        private final String value;

        Severity(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public enum Type {
        CONTENT_HASH_MISMATCH("content_hash_mismatch", Severity.CRITICAL),
        CHAIN_LINK_BROKEN("chain_link_broken", Severity.CRITICAL),
        SEQUENCE_GAP("sequence_gap", Severity.HIGH),
        SEQUENCE_DUPLICATE("sequence_duplicate", Severity.HIGH),
        FIRST_ENTRY_INVALID("first_entry_invalid", Severity.HIGH),
        TIMESTAMP_REGRESSION("timestamp_regression", Severity.MEDIUM),
        ALGORITHM_MISMATCH("algorithm_mismatch", Severity.LOW);

        private final String value;
        private final Severity severity;

        Type(String value, Severity severity) {
            this.value = value;
            this.severity = severity;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public Severity severity() {
            return severity;
        }
    }
}
