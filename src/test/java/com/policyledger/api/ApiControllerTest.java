package com.policyledger.api;

import com.policyledger.policy.engine.PolicyEngine;
import com.policyledger.policy.store.InMemoryPolicyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ApiControllerTest {

    private static final String POLICY = """
        {
          "name": "api-policy",
          "rules": [
            {"id": "no-lockfiles", "name": "No lockfiles", "priority": 10,
             "conditions": [{"type": "file_pattern", "patterns": ["*.lock"]}],
             "action": {"effect": "deny", "reason": "Lockfiles are generated"}},
            {"id": "allow-rest", "name": "Allow", "action": {"effect": "allow"}}
          ]
        }
        """;

    private static final String ENTRY = """
        {
          "actor": {"type": "user", "id": "alice"},
          "action": {"category": "auth", "type": "auth.login.success"},
          "outcome": {"status": "success"}
        }
        """;

    @Autowired MockMvc mvc;
    @Autowired PolicyEngine engine;
    @Autowired InMemoryPolicyStore store;

    private String tenant;

    @BeforeEach
    void setUp() {
        engine.clearPolicies();
        store.clear();
        tenant = "api-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void appendEntry() throws Exception {
        mvc.perform(post("/v1/audit/{tenant}/entries", tenant)
                .contentType(MediaType.APPLICATION_JSON).content(ENTRY))
            .andExpect(status().isCreated());
    }

    @Nested
    @DisplayName("Policies")
    class Policies {

        @Test
        void loadEvaluateAndUnload() throws Exception {
            mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content(POLICY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("loaded"))
                .andExpect(jsonPath("$.policy_id").value("api-policy"))
                .andExpect(jsonPath("$.rule_count").value(2));

            mvc.perform(get("/v1/policies"))
                .andExpect(jsonPath("$", hasItem("api-policy")));

            mvc.perform(post("/v1/policies/evaluate").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"resource\": {\"files\": [\"yarn.lock\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(false))
                .andExpect(jsonPath("$.effect").value("deny"))
                .andExpect(jsonPath("$.matchedRule.id").value("no-lockfiles"));

            mvc.perform(post("/v1/policies/dry-run").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"resource\": {\"files\": [\"README.md\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.wouldEffect").value("allow"))
                .andExpect(jsonPath("$.allRules.length()").value(2));

            mvc.perform(delete("/v1/policies/api-policy")).andExpect(status().isOk());
            mvc.perform(get("/v1/policies/api-policy"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
        }

        @Test
        void invalidDocument_isValidationError() throws Exception {
            mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"bad\", \"rules\": [{\"id\": \"r\", \"name\": \"r\","
                        + " \"conditions\": [{\"type\": \"telepathy\"}], \"action\": {\"effect\": \"allow\"}}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        void duplicateRuleIds_areConflict() throws Exception {
            mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"dup\", \"rules\": ["
                        + "{\"id\": \"r\", \"name\": \"a\", \"action\": {\"effect\": \"allow\"}},"
                        + "{\"id\": \"r\", \"name\": \"b\", \"action\": {\"effect\": \"deny\"}}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("POLICY_CONFLICT"));
        }

        @Test
        void malformedJson_isBadRequest() throws Exception {
            mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }

        @Test
        void storeResolveAndActivate() throws Exception {
            mvc.perform(put("/v1/policies/store").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"global\", \"scope\": \"global\", \"rules\": ["
                        + "{\"id\": \"g\", \"name\": \"g\", \"action\": {\"effect\": \"warn\"}}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scope").value("global"))
                .andExpect(jsonPath("$.scope_target").value("default"));

            mvc.perform(get("/v1/policies/resolve").param("org", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.chainDepth").value(1))
                .andExpect(jsonPath("$.ruleOrigins.g").value("global"));

            mvc.perform(post("/v1/policies/resolve/activate").param("org", "acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.policy_id").value("resolved:acme/*/*"));

            mvc.perform(get("/v1/policies/store").param("scope", "orbit"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
        }
    }

    @Nested
    @DisplayName("Audit")
    class Audit {

        @Test
        void appendQueryAndVerify() throws Exception {
            appendEntry();
            appendEntry();

            mvc.perform(get("/v1/audit/{tenant}/entries", tenant).param("category", "auth").param("order", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.entries[0].chain.sequence").value(0))
                .andExpect(jsonPath("$.entries[1].chain.sequence").value(1));

            mvc.perform(get("/v1/audit/{tenant}/sequence/{seq}", tenant, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actor.id").value("alice"));

            mvc.perform(get("/v1/audit/{tenant}/verify", tenant).param("strict", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.entriesVerified").value(2));

            mvc.perform(get("/v1/audit/{tenant}/metadata", tenant))
                .andExpect(jsonPath("$.entryCount").value(2))
                .andExpect(jsonPath("$.sealed").value(false));
        }

        @Test
        void sealedLog_isConflict() throws Exception {
            appendEntry();
            mvc.perform(post("/v1/audit/{tenant}/seal", tenant).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"reason\": \"audit period closed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sealed").value(true))
                .andExpect(jsonPath("$.sealReason").value("audit period closed"));

            mvc.perform(post("/v1/audit/{tenant}/entries", tenant)
                    .contentType(MediaType.APPLICATION_JSON).content(ENTRY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("LOG_SEALED"));
        }

        @Test
        void invalidEntry_isValidationError() throws Exception {
            mvc.perform(post("/v1/audit/{tenant}/entries", tenant).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"actor\": {\"type\": \"user\", \"id\": \"alice\"},"
                        + " \"action\": {\"category\": \"auth\", \"type\": \"Login\"}, \"outcome\": {\"status\": \"success\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
        }

        @Test
        void unknownTenant_isNotFound() throws Exception {
            mvc.perform(get("/v1/audit/{tenant}/metadata", tenant))
                .andExpect(status().isNotFound());
        }

        @Test
        void verifyReport_andHealth() throws Exception {
            appendEntry();
            appendEntry();
            appendEntry();

            mvc.perform(get("/v1/audit/{tenant}/verify/report", tenant)
                    .param("verifyTimestamps", "true").param("maxEntries", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.stats.entriesVerified").value(2))
                .andExpect(jsonPath("$.stats.continuityPercent").value(100));

            mvc.perform(get("/v1/audit/{tenant}/health", tenant))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEntries").value(3))
                .andExpect(jsonPath("$.algorithmsUsed[0]").value("sha256"));
        }

        @Test
        void export_csvAndUnknownFormat() throws Exception {
            appendEntry();

            mvc.perform(post("/v1/audit/{tenant}/export", tenant).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"format\": \"csv\", \"tenantId\": \"someone-else\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contentType").value("text/csv"))
                .andExpect(jsonPath("$.metadata.tenantId").value(tenant))
                .andExpect(jsonPath("$.metadata.entryCount").value(1));

            mvc.perform(post("/v1/audit/{tenant}/export", tenant).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"format\": \"xml\"}"))
                .andExpect(status().isBadRequest());
        }

        @Test
        void stream_opensEventStream() throws Exception {
            mvc.perform(get("/v1/audit/{tenant}/stream", tenant).accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
        }
    }

    @Nested
    @DisplayName("Gate and evidence")
    class GateAndEvidence {

        @Test
        void gateCheck_recordsDecision() throws Exception {
            mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content(POLICY))
                .andExpect(status().isOk());

            mvc.perform(post("/v1/gate/{tenant}/check", tenant).contentType(MediaType.APPLICATION_JSON)
                    .content("{\"actor\": {\"id\": \"coder-1\", \"type\": \"agent\"},"
                        + " \"action\": {\"name\": \"commit\"}, \"resource\": {\"files\": [\"Cargo.lock\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision.effect").value("deny"))
                .andExpect(jsonPath("$.auditEntry.outcome.status").value("denied"))
                .andExpect(jsonPath("$.auditEntry.chain.sequence").value(0));
        }

        @Test
        void controlEvidence_andSources() throws Exception {
            appendEntry();

            mvc.perform(get("/v1/evidence/{tenant}/controls/{control}", tenant, "CC6.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].source").value("audit_log"));

            mvc.perform(post("/v1/evidence/traces").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"id\": \"trace-1\", \"runId\": \"run-1\", \"agentType\": \"coder\","
                        + " \"timestamp\": \"2024-05-01T10:00:00Z\", \"tenantId\": \"" + tenant + "\","
                        + " \"decision\": {\"action\": \"open_pr\", \"confidence\": 0.7}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.trace_id").value("trace-1"));

            mvc.perform(post("/v1/evidence/collect").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"tenantId\": \"" + tenant + "\", \"controlId\": \"CC8.1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.evidence[0].source").value("decision_trace"));

            mvc.perform(get("/v1/evidence/sources"))
                .andExpect(jsonPath("$", hasItem("audit_log")));

            mvc.perform(post("/v1/evidence/collect").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"tenantId\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
        }
    }
}
