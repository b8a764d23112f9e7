package com.policyledger.contract;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.AuditEntryInput;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditQuery;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditEntryValidatorTest {

    private AuditEntryValidator validator;

    @BeforeEach
    void setUp() {
        validator = new AuditEntryValidator();
    }

    private static AuditEntryInput valid() {
        return AuditEntryInput.of(
            AuditLogEntry.Actor.of(ActorType.SERVICE, "ci-runner"),
            AuditLogEntry.Action.of(ActionCategory.GIT, "git.commit.create"),
            AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS));
    }

    private void assertRejected(String tenantId, AuditEntryInput input, String fragment) {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.validate(tenantId, input));
        assertTrue(ex.getMessage().contains(fragment), ex.getMessage());
    }

    @Test
    void validInput_passes() {
        assertDoesNotThrow(() -> validator.validate("acme", valid()));
    }

    @Test
    void tenant_isRequired() {
        assertRejected(" ", valid(), "tenantId");
    }

    @Test
    void actorAndAction_areRequired() {
        assertRejected("acme", AuditEntryInput.of(null,
            AuditLogEntry.Action.of(ActionCategory.GIT, "git.commit.create"),
            AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS)), "actor");
        assertRejected("acme", AuditEntryInput.of(AuditLogEntry.Actor.of(ActorType.USER, ""),
            AuditLogEntry.Action.of(ActionCategory.GIT, "git.commit.create"),
            AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS)), "actor.id");
        assertRejected("acme", AuditEntryInput.of(AuditLogEntry.Actor.of(ActorType.USER, "bob"),
            AuditLogEntry.Action.of(null, "git.commit.create"),
            AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS)), "action.category");
    }

    @Test
    void actionType_mustBeDottedLowercase() {
        for (String bad : List.of("commit", "Git.Commit", "git..commit", "git.commit.")) {
            assertRejected("acme", AuditEntryInput.of(AuditLogEntry.Actor.of(ActorType.USER, "bob"),
                AuditLogEntry.Action.of(ActionCategory.GIT, bad),
                AuditLogEntry.Outcome.of(OutcomeStatus.SUCCESS)), "action.type");
        }
    }

    @Test
    void negativeDuration_isRejected() {
        assertRejected("acme", AuditEntryInput.of(AuditLogEntry.Actor.of(ActorType.USER, "bob"),
            AuditLogEntry.Action.of(ActionCategory.GIT, "git.commit.create"),
            new AuditLogEntry.Outcome(OutcomeStatus.SUCCESS, null, null, -1L)), "durationMs");
    }

    @Test
    void resource_needsTypeAndId() {
        assertRejected("acme", valid().withResource(new AuditLogEntry.Resource(ResourceType.COMMIT, " ", null, null)),
            "resource.id");
    }

    @Test
    void foreignContextTenant_isRejected() {
        assertRejected("acme", valid().withContext(AuditLogEntry.Context.ofTenant("globex")), "does not match");
    }

    @Test
    void tags_areBounded() {
        assertRejected("acme", valid().withTags(Collections.nCopies(51, "t")), "at most 50 tags");
        assertRejected("acme", valid().withTags(List.of("x".repeat(101))), "at most 100 characters");
    }

    @Test
    void queries_areChecked() {
        assertDoesNotThrow(() -> validator.validate(AuditQuery.forTenant("acme").build()));
        assertThrows(ValidationException.class, () -> validator.validate(AuditQuery.forTenant(null).build()));
        assertThrows(ValidationException.class,
            () -> validator.validate(AuditQuery.forTenant("acme").limit(1001).build()));
        assertThrows(ValidationException.class,
            () -> validator.validate(AuditQuery.forTenant("acme").offset(-1).build()));
        assertThrows(ValidationException.class,
            () -> validator.validate(AuditQuery.forTenant("acme").sequenceRange(-1L, null).build()));
        Instant now = Instant.now();
        assertThrows(ValidationException.class,
            () -> validator.validate(AuditQuery.forTenant("acme").timeRange(now, now.minusSeconds(1)).build()));
    }
}
