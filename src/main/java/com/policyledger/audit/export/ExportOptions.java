package com.policyledger.audit.export;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ResourceType;

import java.time.Instant;

/**
 * What to export and how. Unset flags take their defaults: metadata included,
 * chain blocks left out, comma delimiter, at most {@value #DEFAULT_LIMIT} entries.
 *
 * @param privateKey PKCS#8 PEM RSA key, required when {@code sign} is set
 */
public record ExportOptions(
    ExportFormat format,
    String tenantId,
    Instant startTime,
    Instant endTime,
    Long startSequence,
    Long endSequence,
    String actorId,
    ActionCategory actionCategory,
    ResourceType resourceType,
    Boolean highRiskOnly,
    Integer limit,
    Boolean includeChainData,
    Boolean includeMetadata,
    Boolean prettyPrint,
    String csvDelimiter,
    String deviceVendor,
    String deviceProduct,
    String deviceVersion,
    Boolean sign,
    String privateKey,
    String keyId,
    ExportSignature.Algorithm signatureAlgorithm
) {

    public static final int DEFAULT_LIMIT = 10_000;

    public ExportOptions {
        highRiskOnly = Boolean.TRUE.equals(highRiskOnly);
        limit = limit == null ? DEFAULT_LIMIT : limit;
        includeChainData = Boolean.TRUE.equals(includeChainData);
        includeMetadata = includeMetadata == null || includeMetadata;
        prettyPrint = Boolean.TRUE.equals(prettyPrint);
        csvDelimiter = csvDelimiter == null || csvDelimiter.isEmpty() ? "," : csvDelimiter;
        deviceVendor = deviceVendor == null ? "PolicyLedger" : deviceVendor;
        deviceProduct = deviceProduct == null ? "AuditLog" : deviceProduct;
        deviceVersion = deviceVersion == null ? "1.0" : deviceVersion;
        sign = Boolean.TRUE.equals(sign);
        signatureAlgorithm = signatureAlgorithm == null ? ExportSignature.Algorithm.RSA_SHA256 : signatureAlgorithm;
    }

    public static Builder builder(String tenantId, ExportFormat format) {
        return new Builder(tenantId, format);
    }

    public ExportOptions withTenantId(String tenant) {
        return new ExportOptions(format, tenant, startTime, endTime, startSequence, endSequence, actorId,
            actionCategory, resourceType, highRiskOnly, limit, includeChainData, includeMetadata, prettyPrint,
            csvDelimiter, deviceVendor, deviceProduct, deviceVersion, sign, privateKey, keyId, signatureAlgorithm);
    }

    public static final class Builder {
        private final String tenantId;
        private final ExportFormat format;
        private Instant startTime;
        private Instant endTime;
        private Long startSequence;
        private Long endSequence;
        private String actorId;
        private ActionCategory actionCategory;
        private ResourceType resourceType;
        private boolean highRiskOnly;
        private Integer limit;
        private boolean includeChainData;
        private Boolean includeMetadata;
        private boolean prettyPrint;
        private String csvDelimiter;
        private boolean sign;
        private String privateKey;
        private String keyId;

        private Builder(String tenantId, ExportFormat format) {
            this.tenantId = tenantId;
            this.format = format;
        }

        public Builder timeRange(Instant start, Instant end) {
            this.startTime = start;
            this.endTime = end;
            return this;
        }

        public Builder sequenceRange(Long start, Long end) {
            this.startSequence = start;
            this.endSequence = end;
            return this;
        }

        public Builder actorId(String value) {
            this.actorId = value;
            return this;
        }

        public Builder actionCategory(ActionCategory value) {
            this.actionCategory = value;
            return this;
        }

        public Builder resourceType(ResourceType value) {
            this.resourceType = value;
            return this;
        }

        public Builder highRiskOnly(boolean value) {
            this.highRiskOnly = value;
            return this;
        }

        public Builder limit(int value) {
            this.limit = value;
            return this;
        }

        public Builder includeChainData(boolean value) {
            this.includeChainData = value;
            return this;
        }

        public Builder includeMetadata(boolean value) {
            this.includeMetadata = value;
            return this;
        }

        public Builder prettyPrint(boolean value) {
            this.prettyPrint = value;
            return this;
        }

        public Builder csvDelimiter(String value) {
            this.csvDelimiter = value;
            return this;
        }

        public Builder signWith(String pemPrivateKey, String signingKeyId) {
            this.sign = true;
            this.privateKey = pemPrivateKey;
            this.keyId = signingKeyId;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(format, tenantId, startTime, endTime, startSequence, endSequence, actorId,
                actionCategory, resourceType, highRiskOnly, limit, includeChainData, includeMetadata, prettyPrint,
                csvDelimiter, null, null, null, sign, privateKey, keyId, null);
        }
    }
}
