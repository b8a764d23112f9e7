package com.policyledger.evidence;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.AgentType;
import com.policyledger.audit.AuditEntryInput;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.InMemoryAuditLogStorage;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.AuditEntryValidator;
import com.policyledger.contract.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceCollectorTest {

    private static final String TENANT = "acme";

    private PolicyLedgerProperties properties;
    private AuditLogService auditLog;
    private InMemoryDecisionTraceStore traces;
    private AuditLogEvidenceSource auditSource;
    private DecisionTraceEvidenceSource traceSource;
    private EvidenceCollector collector;

    @BeforeEach
    void setUp() {
        properties = new PolicyLedgerProperties();
        ChainHasher hasher = new ChainHasher();
        ChainVerifier verifier = new ChainVerifier(hasher);
        auditLog = new AuditLogService(new InMemoryAuditLogStorage(), new AuditEntryValidator(), hasher, verifier,
            properties);
        traces = new InMemoryDecisionTraceStore();
        auditSource = new AuditLogEvidenceSource(auditLog, verifier, properties);
        traceSource = new DecisionTraceEvidenceSource(traces, properties);
        collector = new EvidenceCollector(List.of(auditSource, traceSource), properties);
    }

    private AuditLogEntry record(ActionCategory category, String type, String... tags) {
        return auditLog.append(TENANT, AuditEntryInput.of(
                AuditLogEntry.Actor.of(ActorType.USER, "alice"),
                AuditLogEntry.Action.of(category, type),
                AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS))
            .withTags(List.of(tags)));
    }

    private static DecisionTrace trace(String id, AgentType agentType, double confidence,
                                       DecisionTrace.Outcome outcome) {
        return new DecisionTrace(id, "run-1", agentType, Instant.now(), TENANT,
            new DecisionTrace.Inputs("fix the bug", List.of(), 4.0),
            new DecisionTrace.Decision("open_pr", "tests pass", confidence, List.of("skip")),
            outcome);
    }

    @Nested
    @DisplayName("Audit log source")
    class AuditSource {

        @Test
        @DisplayName("CC6.1 returns auth and security entries plus entries tagged CC6.1")
        void controlQuery_returnsMappedCategoriesAndTaggedEntries() {
            AuditLogEntry login = record(ActionCategory.AUTH, "auth.login.success");
            AuditLogEntry mfa = record(ActionCategory.SECURITY, "security.mfa.enable");
            record(ActionCategory.GIT, "git.commit.create");
            AuditLogEntry tagged = record(ActionCategory.GIT, "git.access.review", "CC6.1");
            record(ActionCategory.POLICY, "policy.rule.update");

            EvidenceCollectionResult result = collector.collect(EvidenceQuery.forControl(TENANT, "CC6.1", null, null));

            List<String> entryIds = result.evidence().stream()
                .map(item -> item.evidence().auditLogEntryIds().get(0))
                .toList();
            assertEquals(List.of(mfa.id(), login.id(), tagged.id()), entryIds);
            assertEquals(3, result.bySource().get(EvidenceSourceType.AUDIT_LOG));
            assertEquals(0, result.bySource().get(EvidenceSourceType.DECISION_TRACE));
            assertEquals(3, result.byControl().get("CC6.1"));
            assertTrue(result.evidence().stream().allMatch(item -> item.supports("CC6.1")));
        }

        @Test
        void relevance_rewardsMappedSensitiveAndFailedEntries() {
            record(ActionCategory.AUTH, "auth.login.success");
            auditLog.append(TENANT, AuditEntryInput.of(
                AuditLogEntry.Actor.of(ActorType.USER, "alice"),
                new AuditLogEntry.Action(ActionCategory.AUTH, "auth.token.revoke", null, true),
                AuditLogEntry.Outcome.of(OutcomeStatus.FAILURE)));

            List<CollectedEvidence> evidence = collector.collect(
                EvidenceQuery.forControl(TENANT, "CC6.1", null, null)).evidence();

            assertEquals(1.0, evidence.get(0).relevanceScore(), 1e-9);
            assertEquals(0.7, evidence.get(1).relevanceScore(), 1e-9);
            assertTrue(evidence.get(0).evidence().description().contains("(failure)"));
        }

        @Test
        void window_isVerifiedAsSubsequence() {
            record(ActionCategory.AUTH, "auth.login.success");
            record(ActionCategory.GIT, "git.commit.create");
            record(ActionCategory.AUTH, "auth.logout.success");

            EvidenceCollectionResult result = collector.collect(EvidenceQuery.forControl(TENANT, "CC6.2", null, null));

            assertEquals(2, result.evidence().size());
            assertEquals(2, result.chainVerification().verified());
            assertTrue(result.evidence().stream().allMatch(item -> item.evidence().chainVerified()));
            assertEquals(1, result.evidence().get(0).chainVerification().unverifiableLinks());
            assertEquals(1.0, result.summary().chainVerificationRate());
        }

        @Test
        void verificationCanBeSkipped() {
            record(ActionCategory.AUTH, "auth.login.success");
            EvidenceQuery query = new EvidenceQuery(TENANT, null, null, "CC6.1", null, null, null, null,
                false, null, false);

            EvidenceCollectionResult result = collector.collect(query);
            assertEquals(1, result.chainVerification().skipped());
            assertFalse(result.evidence().get(0).evidence().chainVerified());
        }

        @Test
        void unknownSubControl_fallsBackToParent() {
            record(ActionCategory.ADMIN, "admin.role.grant");
            EvidenceCollectionResult result = collector.collect(EvidenceQuery.forControl(TENANT, "CC6.99", null, null));
            assertEquals(1, result.evidence().size());
        }

        @Test
        void explicitCategories_winOverControlMapping() {
            record(ActionCategory.AUTH, "auth.login.success");
            record(ActionCategory.BILLING, "billing.invoice.create");
            EvidenceQuery query = new EvidenceQuery(TENANT, null, null, "CC6.1", null,
                List.of(ActionCategory.BILLING), null, null, false, null, null);

            List<CollectedEvidence> evidence = collector.collect(query).evidence();
            assertEquals(1, evidence.size());
            assertTrue(evidence.get(0).evidence().description().startsWith("billing:"));
        }
    }

    @Nested
    @DisplayName("Decision trace source")
    class TraceSource {

        @Test
        void relevance_reflectsConfidenceOverrideAndFailure() {
            DecisionTrace plain = trace("t1", AgentType.CODER, 0.5, null);
            DecisionTrace overridden = trace("t2", AgentType.CODER, 0.95, new DecisionTrace.Outcome(
                DecisionTrace.Result.FAILURE, new DecisionTrace.HumanOverride("bob", "wrong fix")));

            assertEquals(0.6, DecisionTraceEvidenceSource.relevance(plain), 1e-9);
            assertEquals(1.0, DecisionTraceEvidenceSource.relevance(overridden), 1e-9);
        }

        @Test
        void changeManagement_readsCodingAgents() {
            traces.record(trace("coder-1", AgentType.CODER, 0.8, null));
            traces.record(trace("triage-1", AgentType.TRIAGE, 0.8, null));

            List<CollectedEvidence> evidence = collector.collectForControl(TENANT,
                new ControlDefinition("CC8.1", "Change authorization", "Change Management"), null, null);

            List<String> ids = evidence.stream().map(item -> item.evidence().id()).toList();
            assertTrue(ids.contains("dt-coder-1"));
            assertFalse(ids.contains("dt-triage-1"));
            CollectedEvidence coder = evidence.stream()
                .filter(item -> item.evidence().id().equals("dt-coder-1")).findFirst().orElseThrow();
            assertFalse(coder.evidence().chainVerified());
            assertEquals(List.of("CC8.1", "CC5.2"), coder.relatedControlIds());
            assertTrue(coder.evidence().description().contains("80%"));
        }

        @Test
        void agentTypes_followControlCategory() {
            assertEquals(List.of(AgentType.TRIAGE, AgentType.REVIEWER),
                DecisionTraceEvidenceSource.agentTypesFor("risk-assessment"));
            assertEquals(List.of(AgentType.values()), DecisionTraceEvidenceSource.agentTypesFor(null));
        }
    }

    @Nested
    @DisplayName("Collection")
    class Collection {

        @Test
        @DisplayName("a failing source does not fail the collection")
        void failingSource_isSkipped() {
            EvidenceSource broken = new EvidenceSource() {
                @Override
                public EvidenceSourceType type() {
                    return EvidenceSourceType.DOCUMENT;
                }

                @Override
                public List<CollectedEvidence> collect(EvidenceQuery query) {
                    throw new IllegalStateException("document store offline");
                }
            };
            record(ActionCategory.AUTH, "auth.login.success");
            EvidenceCollector withBroken = new EvidenceCollector(List.of(broken, auditSource), properties);

            EvidenceCollectionResult result = withBroken.collect(EvidenceQuery.forControl(TENANT, "CC6.1", null, null));
            assertEquals(1, result.evidence().size());
            assertEquals(0, result.bySource().get(EvidenceSourceType.DOCUMENT));
        }

        @Test
        void unavailableSource_isSkipped() {
            EvidenceSource offline = new EvidenceSource() {
                @Override
                public EvidenceSourceType type() {
                    return EvidenceSourceType.POLICY_EVALUATION;
                }

                @Override
                public boolean isAvailable() {
                    return false;
                }

                @Override
                public List<CollectedEvidence> collect(EvidenceQuery query) {
                    throw new AssertionError("must not be called");
                }
            };
            EvidenceCollector withOffline = new EvidenceCollector(List.of(offline, auditSource), properties);

            assertEquals(List.of(EvidenceSourceType.AUDIT_LOG), withOffline.availableSources());
            assertTrue(withOffline.collect(EvidenceQuery.forWindow(TENANT, null, null)).evidence().isEmpty());
        }

        @Test
        void invalidQueries_areRejected() {
            Instant now = Instant.now();
            assertThrows(ValidationException.class,
                () -> collector.collect(EvidenceQuery.forWindow(" ", null, null)));
            assertThrows(ValidationException.class,
                () -> collector.collect(EvidenceQuery.forWindow(TENANT, now, now.minusSeconds(60))));
            assertThrows(ValidationException.class, () -> collector.collect(new EvidenceQuery(TENANT, null, null,
                null, null, null, null, null, false, 0, null)));
        }

        @Test
        void summaryTopAndFilter() {
            record(ActionCategory.SECURITY, "security.alert.raise");
            record(ActionCategory.AUTH, "auth.login.success");
            record(ActionCategory.GIT, "git.commit.create", "CC6.1");

            EvidenceCollectionResult result = collector.collect(EvidenceQuery.forControl(TENANT, "CC6.1", null, null));

            EvidenceCollectionResult.Summary summary = result.summary();
            assertEquals(3, summary.totalEvidence());
            assertEquals((0.85 + 0.7 + 0.5) / 3, summary.averageRelevance(), 1e-9);
            assertEquals(2, result.filterByRelevance(0.69).size());
            assertEquals(1, result.top(1).size());
            assertEquals(0.85, result.top(1).get(0).relevanceScore(), 1e-9);
            assertTrue(result.top(-1).isEmpty());
        }

        @Test
        void multipleControls_shareOneCollection() {
            record(ActionCategory.AUTH, "auth.login.success");
            record(ActionCategory.GIT, "git.commit.create");

            Map<String, List<CollectedEvidence>> grouped = collector.collectForControls(TENANT, List.of(
                new ControlDefinition("CC6.1", "Logical access", null),
                new ControlDefinition("CC8.1", "Change management", null)), null, null);

            assertEquals(1, grouped.get("CC6.1").size());
            assertEquals(1, grouped.get("CC8.1").size());
        }
    }
}
