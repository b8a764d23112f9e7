package com.policyledger.gate;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.AgentType;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.AuditQuery;
import com.policyledger.audit.InMemoryAuditLogStorage;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.ResourceType;
import com.policyledger.audit.SealedLogException;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.AuditEntryValidator;
import com.policyledger.contract.PolicyDocumentValidator;
import com.policyledger.contract.ValidationException;
import com.policyledger.policy.condition.BranchCondition;
import com.policyledger.policy.condition.FilePatternCondition;
import com.policyledger.policy.engine.PolicyEngine;
import com.policyledger.policy.model.ApprovalConfig;
import com.policyledger.policy.model.Effect;
import com.policyledger.policy.model.EvaluationRequest;
import com.policyledger.policy.model.PolicyAction;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyGateServiceTest {

    private static final String TENANT = "acme";

    private AuditLogService auditLog;
    private PolicyGateService gate;

    @BeforeEach
    void setUp() {
        PolicyLedgerProperties properties = new PolicyLedgerProperties();
        ChainHasher hasher = new ChainHasher();
        auditLog = new AuditLogService(new InMemoryAuditLogStorage(), new AuditEntryValidator(), hasher,
            new ChainVerifier(hasher), properties);
        PolicyEngine engine = new PolicyEngine(properties.getEngine(), new PolicyDocumentValidator());
        engine.loadPolicy(new PolicyDocument(null, "gate-policy", null, null, null, null, null, List.of(
            new PolicyRule("block-secrets", "Block secrets", null, true, 100,
                List.of(new FilePatternCondition(List.of("**/*.pem"), null)), null,
                PolicyAction.of(Effect.DENY, "Secrets must not be committed"), null),
            new PolicyRule("review-main", "Review main", null, true, 50,
                List.of(new BranchCondition(List.of("main"), null, null)), null,
                PolicyAction.requireApproval("Main needs review", ApprovalConfig.minApprovers(1)), null),
            new PolicyRule("allow-rest", "Allow the rest", null, true, 0, List.of(), null,
                PolicyAction.of(Effect.ALLOW, null), null))));
        gate = new PolicyGateService(engine, auditLog);
    }

    @Test
    @DisplayName("denied request is recorded with the deny reason")
    void deny_isRecorded() {
        GateDecision result = gate.check(TENANT, EvaluationRequest.builder()
            .actor("coder-7", "agent")
            .action("commit")
            .agent("coder", 0.9)
            .files("config/keys/server.pem")
            .repo("acme", "api")
            .traceId("trace-9")
            .build());

        assertFalse(result.allowed());
        AuditLogEntry entry = result.auditEntry();
        assertEquals(PolicyGateService.DECISION_ACTION, entry.action().type());
        assertEquals(ActionCategory.POLICY, entry.action().category());
        assertEquals(ActorType.AGENT, entry.actor().type());
        assertEquals(AgentType.CODER, entry.actor().agentType());
        assertEquals(OutcomeStatus.DENIED, entry.outcome().status());
        assertEquals("deny", entry.outcome().errorCode());
        assertEquals("Secrets must not be committed", entry.outcome().errorMessage());
        assertEquals("block-secrets", entry.details().get("matchedRuleId"));
        assertEquals("gate-policy", entry.details().get("policyId"));
        assertEquals(List.of("policy-decision", "deny"), entry.tags());
        assertEquals("trace-9", entry.context().traceId());
        assertEquals(ResourceType.REPOSITORY, entry.resource().type());
        assertEquals("acme/api", entry.resource().id());
    }

    @Test
    void pendingApproval_isRecordedAsPending() {
        GateDecision result = gate.check(TENANT, EvaluationRequest.builder()
            .actor("alice", "human")
            .branch("main", true)
            .build());

        assertFalse(result.allowed());
        assertEquals(Effect.REQUIRE_APPROVAL, result.decision().effect());
        assertEquals(OutcomeStatus.PENDING, result.auditEntry().outcome().status());
        assertEquals(2, result.auditEntry().details().get("approvalsNeeded"));
        assertEquals(ActorType.USER, result.auditEntry().actor().type());
    }

    @Test
    void allowedRequest_isRecordedAsSuccess() {
        GateDecision result = gate.check(TENANT, EvaluationRequest.builder().actor("alice", "human").build());

        assertTrue(result.allowed());
        assertEquals(OutcomeStatus.SUCCESS, result.auditEntry().outcome().status());
        assertNull(result.auditEntry().outcome().errorCode());
        assertNull(result.auditEntry().resource());
        assertEquals(1, auditLog.query(AuditQuery.forTenant(TENANT).tag("policy-decision").build()).total());
    }

    @Test
    void everyDecision_extendsTheChain() {
        gate.check(TENANT, EvaluationRequest.builder().build());
        gate.check(TENANT, EvaluationRequest.builder().files("a.pem").build());
        gate.check(TENANT, EvaluationRequest.builder().branch("main", false).build());

        assertEquals(3, auditLog.metadata(TENANT).entryCount());
        assertTrue(auditLog.verifyIntegrity(TENANT).valid());
    }

    @Test
    @DisplayName("no decision is returned when it cannot be recorded")
    void sealedLog_withholdsDecision() {
        gate.check(TENANT, EvaluationRequest.builder().build());
        auditLog.seal(TENANT, "frozen");

        assertThrows(SealedLogException.class, () -> gate.check(TENANT, EvaluationRequest.builder().build()));
    }

    @Test
    void missingTenant_isRejected() {
        assertThrows(ValidationException.class, () -> gate.check(" ", EvaluationRequest.builder().build()));
        assertThrows(ValidationException.class, () -> gate.check(TENANT, null));
    }
}
