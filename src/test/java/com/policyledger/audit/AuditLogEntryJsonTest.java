package com.policyledger.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.AuditEntryValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogEntryJsonTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void storedEntry_survivesJsonAndStillVerifies() throws Exception {
        ChainHasher hasher = new ChainHasher();
        AuditLogService service = new AuditLogService(new InMemoryAuditLogStorage(), new AuditEntryValidator(),
            hasher, new ChainVerifier(hasher), new PolicyLedgerProperties());
        AuditLogEntry entry = service.append("acme", AuditEntryInput.of(
                new AuditLogEntry.Actor(ActorType.AGENT, "coder-1", "Coder", AgentType.CODER,
                    new AuditLogEntry.OnBehalfOf(ActorType.USER, "alice", "assigned issue")),
                AuditLogEntry.Action.of(ActionCategory.GIT, "git.push.force"),
                AuditLogEntry.Outcome.of(OutcomeStatus.BLOCKED))
            .withCompliance(List.of(ComplianceFramework.SOC2))
            .withDetails(Map.of("branch", "main", "commits", 3)));

        String json = mapper.writeValueAsString(entry);
        JsonNode tree = mapper.readTree(json);
        assertEquals("agent", tree.path("actor").path("type").asText());
        assertEquals("coder", tree.path("actor").path("agentType").asText());
        assertEquals("git", tree.path("action").path("category").asText());
        assertEquals("blocked", tree.path("outcome").path("status").asText());
        assertEquals("sha256", tree.path("chain").path("algorithm").asText());
        assertEquals("soc2", tree.path("compliance").get(0).asText());
        assertTrue(tree.path("highRisk").asBoolean());
        assertTrue(tree.path("chain").path("prevHash").isMissingNode());

        AuditLogEntry parsed = mapper.readValue(json, AuditLogEntry.class);
        assertEquals(entry, parsed);
        assertEquals(entry.chain().contentHash(), hasher.computeContentHash(parsed));
    }
}
