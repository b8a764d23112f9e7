package com.policyledger.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.policyledger.audit.AuditLogEntry;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes content hashes of audit entries.
 *
 * The hash input is the canonical JSON of the entry's content fields: object keys
 * sorted at every depth, nulls dropped, no whitespace. The {@code chain} block is
 * never part of the input.
 */
@Component
public class ChainHasher {

    private final ObjectMapper mapper;

    public ChainHasher() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String computeContentHash(AuditLogEntry entry) {
        HashAlgorithm algorithm = entry.chain() != null && entry.chain().algorithm() != null
            ? entry.chain().algorithm()
            : HashAlgorithm.SHA256;
        return computeContentHash(entry, algorithm);
    }

    public String computeContentHash(AuditLogEntry entry, HashAlgorithm algorithm) {
        return hash(canonicalJson(contentFields(entry)), algorithm);
    }

    public String hash(String data, HashAlgorithm algorithm) {
        byte[] digest = algorithm.newDigest().digest(data.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    /**
     * Serializes a value with sorted keys and without null members, so equal
     * content always yields the same string.
     */
    public String canonicalJson(Object value) {
        JsonNode tree = mapper.valueToTree(value);
        try {
            return mapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to canonicalize audit content", ex);
        }
    }

    private Map<String, Object> contentFields(AuditLogEntry entry) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("id", entry.id());
        content.put("schemaVersion", entry.schemaVersion());
        content.put("timestamp", entry.timestamp());
        content.put("actor", entry.actor());
        content.put("action", entry.action());
        content.put("resource", entry.resource());
        content.put("outcome", entry.outcome());
        content.put("context", entry.context());
        content.put("tags", entry.tags());
        content.put("highRisk", entry.highRisk());
        content.put("compliance", entry.compliance());
        content.put("details", entry.details());
        return content;
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            ObjectNode sorted = mapper.createObjectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            for (String name : names) {
                JsonNode child = node.get(name);
                if (child != null && !child.isNull()) {
                    sorted.set(name, canonicalize(child));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = mapper.createArrayNode();
            node.forEach(item -> copy.add(canonicalize(item)));
            return copy;
        }
        return node;
    }
}
