package com.policyledger.audit.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Arrays;

/**
 * Detached RSA signature over the SHA-256 hex digest of an export's content.
 *
 * @param contentHash hex digest that was signed
 * @param signature   Base64 signature bytes
 */
public record ExportSignature(
    Algorithm algorithm,
    String keyId,
    Instant signedAt,
    String contentHash,
    String signature
) {

    public enum Algorithm {
        RSA_SHA256("RSA-SHA256", "SHA256withRSA"),
        RSA_SHA384("RSA-SHA384", "SHA384withRSA"),
        RSA_SHA512("RSA-SHA512", "SHA512withRSA");

        private final String value;
        private final String jcaName;

        Algorithm(String value, String jcaName) {
            this.value = value;
            this.jcaName = jcaName;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public String jcaName() {
            return jcaName;
        }

        @JsonCreator
        public static Algorithm fromValue(String raw) {
            if (raw == null) {
                return null;
            }
            return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(raw) || v.jcaName.equalsIgnoreCase(raw))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown signature algorithm: " + raw));
        }
    }
}
