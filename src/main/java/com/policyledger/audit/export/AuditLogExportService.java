package com.policyledger.audit.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.AuditQuery;
import com.policyledger.audit.AuditQueryResult;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.SortOrder;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.HashAlgorithm;
import com.policyledger.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exports a tenant's audit log for auditors and SIEM tools, optionally signed.
 *
 * Entries are read in sequence order. A signature covers the SHA-256 digest of
 * the exact content string, so any edit to the exported text invalidates it.
 */
@Service
public class AuditLogExportService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogExportService.class);

    static final String EXPORT_VERSION = "1.0";
    private static final int SYSLOG_FACILITY_AUDIT = 13;
    private static final List<String> CSV_HEADERS = List.of(
        "id", "timestamp", "actor_type", "actor_id", "actor_name", "action_type", "action_category",
        "action_description", "resource_type", "resource_id", "resource_name", "outcome_status",
        "outcome_message", "high_risk", "sequence");

    private final AuditLogService auditLogService;
    private final ChainHasher hasher;
    private final ObjectMapper mapper;

    public AuditLogExportService(AuditLogService auditLogService, ChainHasher hasher, ObjectMapper mapper) {
        this.auditLogService = auditLogService;
        this.hasher = hasher;
        this.mapper = mapper;
    }

    public ExportResult export(ExportOptions options) {
        validate(options);
        List<AuditLogEntry> entries = read(options);
        ExportMetadata metadata = metadata(entries, options);
        String content = format(entries, metadata, options);

        ExportSignature signature = null;
        if (options.sign()) {
            signature = sign(content, parsePrivateKey(options.privateKey()), options.keyId(),
                options.signatureAlgorithm());
        }
        log.info("Exported {} audit entries tenant={} format={} signed={}",
            entries.size(), options.tenantId(), options.format().getValue(), signature != null);
        return new ExportResult(content, metadata, signature, options.format().contentType(),
            filename(metadata));
    }

    public List<ExportFormat> supportedFormats() {
        return List.of(ExportFormat.values());
    }

    public ExportSignature sign(String content, PrivateKey key, String keyId, ExportSignature.Algorithm algorithm) {
        String contentHash = hasher.hash(content, HashAlgorithm.SHA256);
        try {
            Signature signer = Signature.getInstance(algorithm.jcaName());
            signer.initSign(key);
            signer.update(contentHash.getBytes(StandardCharsets.UTF_8));
            String encoded = Base64.getEncoder().encodeToString(signer.sign());
            return new ExportSignature(algorithm, keyId, Instant.now(), contentHash, encoded);
        } catch (GeneralSecurityException ex) {
            throw new ValidationException("export could not be signed with key " + keyId + ": " + ex.getMessage());
        }
    }

    /**
     * True only when the content still hashes to the signed digest and the
     * signature over that digest checks out against {@code key}.
     */
    public boolean verifySignature(String content, ExportSignature signature, PublicKey key) {
        if (content == null || signature == null || signature.algorithm() == null) {
            return false;
        }
        String contentHash = hasher.hash(content, HashAlgorithm.SHA256);
        if (!contentHash.equals(signature.contentHash())) {
            log.warn("Export content does not match signed digest (key={})", signature.keyId());
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(signature.algorithm().jcaName());
            verifier.initVerify(key);
            verifier.update(contentHash.getBytes(StandardCharsets.UTF_8));
            boolean valid = verifier.verify(Base64.getDecoder().decode(signature.signature()));
            if (!valid) {
                log.warn("Export signature rejected (key={})", signature.keyId());
            }
            return valid;
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            log.warn("Export signature could not be checked (key={}): {}", signature.keyId(), ex.getMessage());
            return false;
        }
    }

    public boolean verifySignature(String content, ExportSignature signature, String publicKeyPem) {
        return verifySignature(content, signature, parsePublicKey(publicKeyPem));
    }

    static PrivateKey parsePrivateKey(String pem) {
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pemBody(pem)));
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new ValidationException("privateKey must be a PKCS#8 PEM RSA key");
        }
    }

    static PublicKey parsePublicKey(String pem) {
        try {
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(pemBody(pem)));
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            throw new ValidationException("publicKey must be an X.509 PEM RSA key");
        }
    }

    private static byte[] pemBody(String pem) {
        if (pem == null) {
            throw new IllegalArgumentException("missing key");
        }
        String body = pem.lines()
            .filter(line -> !line.startsWith("-----"))
            .collect(Collectors.joining())
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }

    private static void validate(ExportOptions options) {
        if (options == null || options.tenantId() == null || options.tenantId().isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        if (options.format() == null) {
            throw new ValidationException("format is required");
        }
        if (options.limit() < 1) {
            throw new ValidationException("limit must be >= 1");
        }
        if (options.sign() && (options.privateKey() == null || options.keyId() == null || options.keyId().isBlank())) {
            throw new ValidationException("signing requires privateKey and keyId");
        }
    }

    private List<AuditLogEntry> read(ExportOptions options) {
        List<AuditLogEntry> entries = new ArrayList<>();
        int offset = 0;
        while (entries.size() < options.limit()) {
            AuditQuery.Builder query = AuditQuery.forTenant(options.tenantId())
                .timeRange(options.startTime(), options.endTime())
                .sequenceRange(options.startSequence(), options.endSequence())
                .actorId(options.actorId())
                .resourceType(options.resourceType())
                .highRiskOnly(options.highRiskOnly())
                .limit(Math.min(AuditQuery.MAX_LIMIT, options.limit() - entries.size()))
                .offset(offset)
                .order(SortOrder.ASC);
            if (options.actionCategory() != null) {
                query.category(options.actionCategory());
            }
            AuditQueryResult page = auditLogService.query(query.build());
            entries.addAll(page.entries());
            if (!page.hasMore() || page.entries().isEmpty()) {
                break;
            }
            offset += page.entries().size();
        }
        return entries;
    }

    private static ExportMetadata metadata(List<AuditLogEntry> entries, ExportOptions options) {
        ExportMetadata.Filters filters = new ExportMetadata.Filters(options.startTime(), options.endTime(),
            options.startSequence(), options.endSequence(), options.actorId(), options.actionCategory(),
            options.resourceType(), options.highRiskOnly() ? Boolean.TRUE : null);
        ExportMetadata.SequenceRange sequences = entries.isEmpty()
            ? new ExportMetadata.SequenceRange(0, -1)
            : new ExportMetadata.SequenceRange(entries.get(0).chain().sequence(),
                entries.get(entries.size() - 1).chain().sequence());
        ExportMetadata.TimeRange times = entries.isEmpty()
            ? null
            : new ExportMetadata.TimeRange(
                entries.stream().map(AuditLogEntry::timestamp).min(Comparator.naturalOrder()).orElseThrow(),
                entries.stream().map(AuditLogEntry::timestamp).max(Comparator.naturalOrder()).orElseThrow());
        return new ExportMetadata(Instant.now(), options.format(), options.tenantId(), filters, entries.size(),
            sequences, times, EXPORT_VERSION, AuditLogEntry.SCHEMA_VERSION);
    }

    private String format(List<AuditLogEntry> entries, ExportMetadata metadata, ExportOptions options) {
        switch (options.format()) {
            case JSON:
                return json(entries, metadata, options);
            case JSON_LINES:
                return jsonLines(entries, metadata, options);
            case CSV:
                return csv(entries, options.csvDelimiter());
            case CEF:
                return cef(entries, options);
            case SYSLOG:
                return syslog(entries, options);
            default:
                throw new ValidationException("Unsupported export format: " + options.format().getValue());
        }
    }

    private String json(List<AuditLogEntry> entries, ExportMetadata metadata, ExportOptions options) {
        ObjectNode root = mapper.createObjectNode();
        if (options.includeMetadata()) {
            root.set("metadata", mapper.valueToTree(metadata));
        }
        ArrayNode array = root.putArray("entries");
        entries.forEach(entry -> array.add(entryNode(entry, options.includeChainData())));
        try {
            return options.prettyPrint()
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root)
                : mapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize audit export", ex);
        }
    }

    private String jsonLines(List<AuditLogEntry> entries, ExportMetadata metadata, ExportOptions options) {
        List<String> lines = new ArrayList<>();
        if (options.includeMetadata()) {
            ObjectNode header = mapper.createObjectNode();
            header.put("_type", "metadata");
            header.setAll((ObjectNode) mapper.valueToTree(metadata));
            lines.add(write(header));
        }
        for (AuditLogEntry entry : entries) {
            lines.add(write(entryNode(entry, options.includeChainData())));
        }
        return String.join("\n", lines);
    }

    private ObjectNode entryNode(AuditLogEntry entry, boolean includeChainData) {
        ObjectNode node = mapper.valueToTree(entry);
        if (!includeChainData) {
            node.remove("chain");
        }
        return node;
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize audit export", ex);
        }
    }

    static String csv(List<AuditLogEntry> entries, String delimiter) {
        List<String> lines = new ArrayList<>();
        lines.add(String.join(delimiter, CSV_HEADERS));
        for (AuditLogEntry entry : entries) {
            List<String> row = List.of(
                entry.id(),
                entry.timestamp().toString(),
                entry.actor().type().getValue(),
                entry.actor().id(),
                orEmpty(entry.actor().displayName()),
                entry.action().type(),
                entry.action().category().getValue(),
                orEmpty(entry.action().description()),
                entry.resource() == null || entry.resource().type() == null ? "" : entry.resource().type().getValue(),
                entry.resource() == null ? "" : orEmpty(entry.resource().id()),
                entry.resource() == null ? "" : orEmpty(entry.resource().name()),
                entry.outcome().status().getValue(),
                orEmpty(entry.outcome().errorMessage()),
                String.valueOf(entry.highRisk()),
                String.valueOf(entry.chain().sequence()));
            lines.add(row.stream().map(value -> csvField(value, delimiter)).collect(Collectors.joining(delimiter)));
        }
        return String.join("\n", lines);
    }

    private static String csvField(String value, String delimiter) {
        if (value.contains(delimiter) || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /** ArcSight Common Event Format, one event per line. */
    static String cef(List<AuditLogEntry> entries, ExportOptions options) {
        List<String> lines = new ArrayList<>();
        for (AuditLogEntry entry : entries) {
            String signatureId = entry.action().category().getValue() + "." + entry.action().type();
            String name = entry.action().description() != null ? entry.action().description() : entry.action().type();

            List<String> extensions = new ArrayList<>(List.of(
                "rt=" + entry.timestamp().toEpochMilli(),
                "src=" + cefValue(entry.actor().id()),
                "suser=" + cefValue(entry.actor().displayName() != null ? entry.actor().displayName() : entry.actor().id()),
                "act=" + cefValue(entry.action().type()),
                "cat=" + cefValue(entry.action().category().getValue()),
                "outcome=" + cefValue(entry.outcome().status().getValue()),
                "cs1=" + cefValue(entry.id()),
                "cs1Label=EntryID",
                "cn1=" + entry.chain().sequence(),
                "cn1Label=Sequence"));
            if (entry.resource() != null && entry.resource().type() != null) {
                extensions.add("dvc=" + cefValue(entry.resource().type().getValue()));
                extensions.add("dvchost=" + cefValue(orEmpty(entry.resource().id())));
            }
            if (entry.highRisk()) {
                extensions.add("cs2=high_risk");
                extensions.add("cs2Label=RiskLevel");
            }
            lines.add("CEF:0|" + cefHeader(options.deviceVendor()) + "|" + cefHeader(options.deviceProduct())
                + "|" + cefHeader(options.deviceVersion()) + "|" + cefHeader(signatureId) + "|" + cefHeader(name)
                + "|" + cefSeverity(entry) + "|" + String.join(" ", extensions));
        }
        return String.join("\n", lines);
    }

    static int cefSeverity(AuditLogEntry entry) {
        if (entry.highRisk()) {
            return 8;
        }
        OutcomeStatus status = entry.outcome().status();
        if (status == OutcomeStatus.FAILURE || status == OutcomeStatus.DENIED || status == OutcomeStatus.BLOCKED) {
            return 5;
        }
        return status == OutcomeStatus.PARTIAL ? 3 : 1;
    }

    private static String cefHeader(String value) {
        return value.replace("\\", "\\\\").replace("|", "\\|");
    }

    private static String cefValue(String value) {
        return value.replace("\\", "\\\\").replace("=", "\\=").replace("\n", "\\n");
    }

    /** RFC 5424 lines under the log-audit facility. */
    static String syslog(List<AuditLogEntry> entries, ExportOptions options) {
        List<String> lines = new ArrayList<>();
        for (AuditLogEntry entry : entries) {
            int priority = SYSLOG_FACILITY_AUDIT * 8 + syslogSeverity(entry);
            String msgId = entry.action().category().getValue() + "." + entry.action().type();
            String structured = "[audit@policyledger entryId=\"" + sdValue(entry.id())
                + "\" actor=\"" + sdValue(entry.actor().id())
                + "\" action=\"" + sdValue(entry.action().type())
                + "\" outcome=\"" + entry.outcome().status().getValue() + "\""
                + (entry.highRisk() ? " highRisk=\"true\"" : "") + "]";
            String message = entry.action().description() != null
                ? entry.action().description()
                : entry.actor().id() + " performed " + entry.action().type();
            lines.add("<" + priority + ">1 " + entry.timestamp() + " - " + options.deviceProduct() + " "
                + entry.chain().sequence() + " " + msgId + " " + structured + " " + message);
        }
        return String.join("\n", lines);
    }

    static int syslogSeverity(AuditLogEntry entry) {
        if (entry.highRisk()) {
            return 2;
        }
        OutcomeStatus status = entry.outcome().status();
        if (status == OutcomeStatus.FAILURE || status == OutcomeStatus.DENIED || status == OutcomeStatus.BLOCKED) {
            return 3;
        }
        return status == OutcomeStatus.PARTIAL ? 4 : 6;
    }

    private static String sdValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("]", "\\]");
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String filename(ExportMetadata metadata) {
        String stamp = metadata.exportedAt().toString().replaceAll("[:.]", "-");
        return "audit-export-" + metadata.tenantId() + "-" + stamp + "." + metadata.format().extension();
    }
}
