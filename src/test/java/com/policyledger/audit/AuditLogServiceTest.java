package com.policyledger.audit;

import com.policyledger.api.NotFoundException;
import com.policyledger.chain.ChainHasher;
import com.policyledger.chain.ChainIntegrityException;
import com.policyledger.chain.ChainVerificationResult;
import com.policyledger.chain.ChainVerifier;
import com.policyledger.chain.MerkleTree;
import com.policyledger.chain.HashAlgorithm;
import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.AuditEntryValidator;
import com.policyledger.contract.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogServiceTest {

    private static final String TENANT = "acme";

    private final ChainHasher hasher = new ChainHasher();
    private final ChainVerifier verifier = new ChainVerifier(hasher);
    private PolicyLedgerProperties properties;
    private InMemoryAuditLogStorage storage;
    private AuditLogService service;

    @BeforeEach
    void setUp() {
        properties = new PolicyLedgerProperties();
        storage = new InMemoryAuditLogStorage();
        service = newService(storage);
    }

    private AuditLogService newService(AuditLogStorage backend) {
        return new AuditLogService(backend, new AuditEntryValidator(), hasher, verifier, properties);
    }

    private static AuditEntryInput input(ActionCategory category, String type) {
        return AuditEntryInput.of(
            AuditLogEntry.Actor.of(ActorType.USER, "alice"),
            AuditLogEntry.Action.of(category, type),
            AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS));
    }

    @Nested
    @DisplayName("Append")
    class Append {

        @Test
        void firstEntry_startsChain() {
            AuditLogEntry entry = service.append(TENANT, input(ActionCategory.POLICY, "policy.rule.create"));

            assertEquals(0, entry.chain().sequence());
            assertNull(entry.chain().prevHash());
            assertEquals(HashAlgorithm.SHA256, entry.chain().algorithm());
            assertEquals(hasher.computeContentHash(entry), entry.chain().contentHash());
            assertEquals(TENANT, entry.tenantId());
            assertTrue(entry.id().startsWith("alog-"));
            assertEquals(AuditLogEntry.SCHEMA_VERSION, entry.schemaVersion());
        }

        @Test
        void subsequentEntries_linkToPredecessor() {
            AuditLogEntry first = service.append(TENANT, input(ActionCategory.POLICY, "policy.rule.create"));
            AuditLogEntry second = service.append(TENANT, input(ActionCategory.POLICY, "policy.rule.update"));

            assertEquals(1, second.chain().sequence());
            assertEquals(first.chain().contentHash(), second.chain().prevHash());

            AuditLogMetadata metadata = service.metadata(TENANT);
            assertEquals(1, metadata.latestSequence());
            assertEquals(2, metadata.entryCount());
            assertEquals(second.chain().contentHash(), metadata.headHash());
        }

        @Test
        void tenants_haveIndependentChains() {
            service.append(TENANT, input(ActionCategory.POLICY, "policy.rule.create"));
            AuditLogEntry other = service.append("globex", input(ActionCategory.POLICY, "policy.rule.create"));

            assertEquals(0, other.chain().sequence());
            assertNull(other.chain().prevHash());
        }

        @Test
        void contextTenant_mustMatchTarget() {
            AuditEntryInput foreign = input(ActionCategory.AUTH, "auth.login.success")
                .withContext(AuditLogEntry.Context.ofTenant("globex"));
            assertThrows(ValidationException.class, () -> service.append(TENANT, foreign));
        }

        @Test
        void knownDangerousActions_areHighRisk() {
            assertTrue(service.append(TENANT, input(ActionCategory.GIT, "git.push.force")).highRisk());
            assertTrue(service.append(TENANT, input(ActionCategory.DATA, "secret.delete.all")).highRisk());
            assertFalse(service.append(TENANT, input(ActionCategory.GIT, "git.push")).highRisk());

            AuditEntryInput sensitive = AuditEntryInput.of(
                AuditLogEntry.Actor.of(ActorType.USER, "alice"),
                new AuditLogEntry.Action(ActionCategory.CONFIG, "config.flag.update", null, true),
                AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS));
            assertTrue(service.append(TENANT, sensitive).highRisk());
        }

        @Test
        @DisplayName("sealed log rejects appends and keeps its entry count")
        void sealedLog_rejectsAppends() {
            service.append(TENANT, input(ActionCategory.ADMIN, "admin.setting.update"));
            AuditLogMetadata sealed = service.seal(TENANT, "quarter close");
            assertTrue(sealed.sealed());
            assertEquals("quarter close", sealed.sealReason());

            assertThrows(SealedLogException.class,
                () -> service.append(TENANT, input(ActionCategory.ADMIN, "admin.setting.update")));
            assertEquals(1, service.metadata(TENANT).entryCount());
            assertThrows(SealedLogException.class, () -> service.seal(TENANT, "again"));
        }

        @Test
        void subscribers_receiveAppendedEntries() {
            List<AuditLogEntry> received = new CopyOnWriteArrayList<>();
            String id = service.subscribe(received::add);
            service.subscribe(entry -> {
                throw new IllegalStateException("broken subscriber");
            });

            AuditLogEntry entry = service.append(TENANT, input(ActionCategory.AGENT, "agent.run.start"));
            service.unsubscribe(id);
            service.append(TENANT, input(ActionCategory.AGENT, "agent.run.finish"));

            assertEquals(List.of(entry), received);
        }

        @Test
        void batch_returnsMerkleRootOfContentHashes() {
            AuditLogService.BatchAppendResult result = service.appendBatch(TENANT, List.of(
                input(ActionCategory.GIT, "git.commit.create"),
                input(ActionCategory.GIT, "git.branch.create"),
                input(ActionCategory.GIT, "git.pr.open")));

            List<String> leaves = result.entries().stream().map(e -> e.chain().contentHash()).toList();
            assertEquals(3, result.entries().size());
            assertEquals(MerkleTree.build(hasher, HashAlgorithm.SHA256, leaves).rootHash(), result.merkleRoot());
            assertNull(service.appendBatch(TENANT, List.of()).merkleRoot());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("parallel appends produce a gap-free verifiable chain")
        void concurrentAppends_produceGapFreeChain() throws Exception {
            properties.getAudit().setMaxAppendRetries(10_000);
            AuditLogService concurrent = newService(storage);
            int threads = 8;
            int perThread = 25;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        concurrent.append(TENANT, input(ActionCategory.AGENT, "agent.step.run")
                            .withDetails(Map.of("worker", worker, "i", i)));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            pool.shutdown();

            int total = threads * perThread;
            List<AuditLogEntry> entries = storage.getEntries(TENANT, 0, total - 1);
            assertEquals(total, entries.size());
            Set<Long> sequences = new HashSet<>();
            entries.forEach(e -> sequences.add(e.chain().sequence()));
            assertEquals(total, sequences.size());
            assertTrue(concurrent.verifyIntegrity(TENANT).valid());
        }

        @Test
        void lostHeadRace_isRetried() {
            AtomicInteger conflicts = new AtomicInteger(1);
            AuditLogStorage flaky = new DelegatingStorage(storage) {
                @Override
                public void appendIfHead(AuditLogEntry entry, long expectedSequence, String expectedHeadHash) {
                    if (conflicts.getAndDecrement() > 0) {
                        throw new ConcurrentAppendException("simulated race");
                    }
                    super.appendIfHead(entry, expectedSequence, expectedHeadHash);
                }
            };

            AuditLogEntry entry = newService(flaky).append(TENANT, input(ActionCategory.POLICY, "policy.rule.create"));
            assertEquals(0, entry.chain().sequence());
            assertEquals(1, storage.getMetadata(TENANT).orElseThrow().entryCount());
        }

        @Test
        void exhaustedRetries_surfaceConflict() {
            properties.getAudit().setMaxAppendRetries(3);
            AtomicInteger attempts = new AtomicInteger();
            AuditLogStorage alwaysMoving = new DelegatingStorage(storage) {
                @Override
                public void appendIfHead(AuditLogEntry entry, long expectedSequence, String expectedHeadHash) {
                    attempts.incrementAndGet();
                    throw new ConcurrentAppendException("simulated race");
                }
            };

            AuditLogService limited = newService(alwaysMoving);
            assertThrows(ConcurrentAppendException.class,
                () -> limited.append(TENANT, input(ActionCategory.POLICY, "policy.rule.create")));
            assertEquals(3, attempts.get());
        }
    }

    @Nested
    @DisplayName("Query")
    class Query {

        @BeforeEach
        void seed() {
            service.append(TENANT, input(ActionCategory.AUTH, "auth.login.success").withTags(List.of("CC6.1")));
            service.append(TENANT, AuditEntryInput.of(
                    AuditLogEntry.Actor.of(ActorType.AGENT, "coder-1"),
                    AuditLogEntry.Action.of(ActionCategory.GIT, "git.push.force"),
                    new AuditLogEntry.Outcome(OutcomeStatus.DENIED, "POLICY", "blocked", null))
                .withContext(AuditLogEntry.Context.ofTenant(TENANT).withTraceId("trace-1"))
                .withDetails(Map.of("branch", "main")));
            service.append(TENANT, input(ActionCategory.POLICY, "policy.rule.update")
                .withResource(AuditLogEntry.Resource.of(ResourceType.POLICY, "pol-1")));
        }

        @Test
        void defaultOrder_isNewestFirst() {
            AuditQueryResult result = service.query(AuditQuery.forTenant(TENANT).build());
            assertEquals(3, result.total());
            assertEquals(List.of(2L, 1L, 0L),
                result.entries().stream().map(e -> e.chain().sequence()).toList());
        }

        @Test
        void filters_combineWithAnd() {
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).highRiskOnly(true).build()).total());
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).actorType(ActorType.AGENT).build()).total());
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).tag("CC6.1").build()).total());
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).traceId("trace-1").build()).total());
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).resourceType(ResourceType.POLICY).build()).total());
            assertEquals(1, service.query(AuditQuery.forTenant(TENANT).searchText("MAIN").build()).total());
            assertEquals(2, service.query(AuditQuery.forTenant(TENANT)
                .categories(List.of(ActionCategory.AUTH, ActionCategory.POLICY)).build()).total());
            assertEquals(0, service.query(AuditQuery.forTenant(TENANT)
                .category(ActionCategory.AUTH).actorType(ActorType.AGENT).build()).total());
        }

        @Test
        void paging_reportsHasMore() {
            AuditQueryResult page = service.query(AuditQuery.forTenant(TENANT)
                .order(SortOrder.ASC).limit(2).build());
            assertEquals(2, page.entries().size());
            assertTrue(page.hasMore());
            assertEquals(0, page.entries().get(0).chain().sequence());

            AuditQueryResult rest = service.query(AuditQuery.forTenant(TENANT)
                .order(SortOrder.ASC).limit(2).offset(2).build());
            assertEquals(1, rest.entries().size());
            assertFalse(rest.hasMore());
        }

        @Test
        void filteredQuery_canAttachVerification() {
            AuditQueryResult result = service.query(AuditQuery.forTenant(TENANT)
                .categories(List.of(ActionCategory.AUTH, ActionCategory.POLICY))
                .includeChainVerification(true)
                .build());
            assertNotNull(result.chainVerification());
            assertTrue(result.chainVerification().valid());
            assertEquals(1, result.chainVerification().unverifiableLinks());
        }

        @Test
        void invalidQuery_isRejected() {
            assertThrows(ValidationException.class,
                () -> service.query(AuditQuery.forTenant(TENANT).limit(0).build()));
            assertThrows(ValidationException.class, () -> service.query(AuditQuery.forTenant(TENANT)
                .timeRange(Instant.parse("2024-02-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z")).build()));
        }

        @Test
        void lookups_byIdAndSequence() {
            AuditLogEntry bySequence = service.getEntryBySequence(TENANT, 1);
            assertEquals(bySequence, service.getEntry(TENANT, bySequence.id()));
            assertThrows(NotFoundException.class, () -> service.getEntry(TENANT, "missing"));
            assertThrows(NotFoundException.class, () -> service.getEntryBySequence(TENANT, 9));
            assertThrows(NotFoundException.class, () -> service.metadata("nobody"));
        }
    }

    @Nested
    @DisplayName("Integrity")
    class Integrity {

        @Test
        void intactLog_verifies() {
            for (int i = 0; i < 5; i++) {
                service.append(TENANT, input(ActionCategory.CONFIG, "config.value.update"));
            }
            ChainVerificationResult full = service.verifyIntegrity(TENANT);
            assertTrue(full.valid());
            assertEquals(5, full.entriesVerified());

            ChainVerificationResult range = service.verifyIntegrity(TENANT, 2L, 3L);
            assertTrue(range.valid());
            assertEquals(2, range.entriesVerified());
            assertTrue(service.assertIntegrity(TENANT).valid());
        }

        @Test
        void emptyLog_verifies() {
            storage.getOrCreateLog(TENANT);
            assertTrue(service.verifyIntegrity(TENANT).valid());
        }

        @Test
        void tamperedStorage_failsAssertion() {
            service.append(TENANT, input(ActionCategory.CONFIG, "config.value.update"));
            service.append(TENANT, input(ActionCategory.CONFIG, "config.value.update"));
            AuditLogStorage tampering = new DelegatingStorage(storage) {
                @Override
                public List<AuditLogEntry> getEntries(String tenantId, long from, long to) {
                    List<AuditLogEntry> entries = new ArrayList<>(super.getEntries(tenantId, from, to));
                    AuditLogEntry e = entries.get(0);
                    entries.set(0, new AuditLogEntry(e.id(), e.schemaVersion(), e.timestamp(),
                        AuditLogEntry.Actor.of(ActorType.USER, "mallory"), e.action(), e.resource(), e.outcome(),
                        e.context(), e.chain(), e.tags(), e.highRisk(), e.compliance(), e.details()));
                    return entries;
                }
            };

            AuditLogService reader = newService(tampering);
            ChainIntegrityException ex = assertThrows(ChainIntegrityException.class,
                () -> reader.assertIntegrity(TENANT));
            assertEquals(0L, ex.getFirstInvalidSequence());
        }
    }

    /** Forwards to a real storage so tests can override single operations. */
    private static class DelegatingStorage implements AuditLogStorage {

        private final AuditLogStorage delegate;

        DelegatingStorage(AuditLogStorage delegate) {
            this.delegate = delegate;
        }

        @Override
        public AuditLogMetadata getOrCreateLog(String tenantId) {
            return delegate.getOrCreateLog(tenantId);
        }

        @Override
        public Optional<AuditLogMetadata> getMetadata(String tenantId) {
            return delegate.getMetadata(tenantId);
        }

        @Override
        public void appendIfHead(AuditLogEntry entry, long expectedSequence, String expectedHeadHash) {
            delegate.appendIfHead(entry, expectedSequence, expectedHeadHash);
        }

        @Override
        public AuditQueryResult query(AuditQuery query) {
            return delegate.query(query);
        }

        @Override
        public Optional<AuditLogEntry> getEntry(String tenantId, String entryId) {
            return delegate.getEntry(tenantId, entryId);
        }

        @Override
        public Optional<AuditLogEntry> getEntryBySequence(String tenantId, long sequence) {
            return delegate.getEntryBySequence(tenantId, sequence);
        }

        @Override
        public List<AuditLogEntry> getEntries(String tenantId, long fromSequence, long toSequence) {
            return delegate.getEntries(tenantId, fromSequence, toSequence);
        }

        @Override
        public AuditLogMetadata seal(String tenantId, String reason) {
            return delegate.seal(tenantId, reason);
        }
    }
}
