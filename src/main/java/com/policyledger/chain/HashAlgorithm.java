package com.policyledger.chain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Digest algorithms usable for audit chain hashing. The chosen algorithm is
 * recorded on every entry so a log can be verified without outside configuration.
 */
public enum HashAlgorithm {
    SHA256("sha256", "SHA-256"),
    SHA384("sha384", "SHA-384"),
    SHA512("sha512", "SHA-512");

    private final String value;
    private final String jcaName;

    HashAlgorithm(String value, String jcaName) {
        this.value = value;
        this.jcaName = jcaName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException ex) {
            // every JRE is required to ship the SHA-2 family
            throw new IllegalStateException(jcaName + " not available", ex);
        }
    }

    @JsonCreator
    public static HashAlgorithm fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw) || v.jcaName.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown hash algorithm: " + raw));
    }
}
