package com.policyledger.contract;

import com.policyledger.audit.AuditEntryInput;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditQuery;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks audit entry inputs and queries before they reach the log.
 */
@Component
public class AuditEntryValidator {

    private static final Pattern ACTION_TYPE = Pattern.compile("^[a-z]+(\\.[a-z_]+)+$");
    private static final int MAX_TAGS = 50;
    private static final int MAX_TAG_LENGTH = 100;

    public void validate(String tenantId, AuditEntryInput input) {
        requireString(tenantId, "tenantId is required");
        requireNonNull(input, "audit entry input cannot be null");

        AuditLogEntry.Actor actor = input.actor();
        requireNonNull(actor, "actor is required");
        requireNonNull(actor.type(), "actor.type is required");
        requireString(actor.id(), "actor.id is required");
        requireMaxLength(actor.id(), 200, "actor.id must be at most 200 characters");
        if (actor.onBehalfOf() != null) {
            requireNonNull(actor.onBehalfOf().type(), "actor.onBehalfOf.type is required");
            requireString(actor.onBehalfOf().id(), "actor.onBehalfOf.id is required");
        }

        AuditLogEntry.Action action = input.action();
        requireNonNull(action, "action is required");
        requireNonNull(action.category(), "action.category is required");
        requireString(action.type(), "action.type is required");
        if (!ACTION_TYPE.matcher(action.type()).matches()) {
            throw new ValidationException(
                "action.type must be dot-separated lowercase segments like policy.rule.evaluated: " + action.type());
        }

        AuditLogEntry.Outcome outcome = input.outcome();
        requireNonNull(outcome, "outcome is required");
        requireNonNull(outcome.status(), "outcome.status is required");
        if (outcome.durationMs() != null && outcome.durationMs() < 0) {
            throw new ValidationException("outcome.durationMs must be >= 0");
        }

        if (input.resource() != null) {
            requireNonNull(input.resource().type(), "resource.type is required");
            requireString(input.resource().id(), "resource.id is required");
            requireMaxLength(input.resource().id(), 500, "resource.id must be at most 500 characters");
        }

        if (input.context() != null && input.context().tenantId() != null
                && !input.context().tenantId().equals(tenantId)) {
            throw new ValidationException("context.tenantId " + input.context().tenantId()
                + " does not match target tenant " + tenantId);
        }

        validateTags(input.tags());
    }

    public void validate(AuditQuery query) {
        requireNonNull(query, "query cannot be null");
        requireString(query.tenantId(), "tenantId is required");
        if (query.limit() < 1 || query.limit() > AuditQuery.MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + AuditQuery.MAX_LIMIT);
        }
        if (query.offset() < 0) {
            throw new ValidationException("offset must be >= 0");
        }
        if (query.startTime() != null && query.endTime() != null && query.endTime().isBefore(query.startTime())) {
            throw new ValidationException("endTime must not be before startTime");
        }
        if (query.startSequence() != null && query.startSequence() < 0) {
            throw new ValidationException("startSequence must be >= 0");
        }
    }

    private void validateTags(List<String> tags) {
        if (tags == null) {
            return;
        }
        if (tags.size() > MAX_TAGS) {
            throw new ValidationException("at most " + MAX_TAGS + " tags are allowed");
        }
        for (String tag : tags) {
            requireString(tag, "tags must not contain blank values");
            requireMaxLength(tag, MAX_TAG_LENGTH, "tag must be at most " + MAX_TAG_LENGTH + " characters: " + tag);
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }

    private void requireMaxLength(String value, int max, String message) {
        if (value.length() > max) {
            throw new ValidationException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ValidationException(message);
        }
    }
}
