package com.policyledger.contract;

import com.policyledger.policy.condition.AgentCondition;
import com.policyledger.policy.condition.ComparisonOperator;
import com.policyledger.policy.condition.ComplexityCondition;
import com.policyledger.policy.condition.CustomCondition;
import com.policyledger.policy.condition.CustomOperator;
import com.policyledger.policy.condition.FilePatternCondition;
import com.policyledger.policy.condition.LabelCondition;
import com.policyledger.policy.condition.PolicyCondition;
import com.policyledger.policy.condition.TimeWindowCondition;
import com.policyledger.policy.model.ApprovalConfig;
import com.policyledger.policy.model.ConditionGroup;
import com.policyledger.policy.model.LogicalOperator;
import com.policyledger.policy.model.NotificationConfig;
import com.policyledger.policy.model.PolicyAction;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyRule;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural checks for policy documents. A document either passes completely or
 * is refused with the first problem found.
 */
@Component
public class PolicyDocumentValidator {

    private static final Pattern RULE_ID = Pattern.compile("^[A-Za-z0-9-]+$");
    private static final int MAX_NAME_LENGTH = 100;

    public void validate(PolicyDocument document) {
        requireNonNull(document, "policy document cannot be null");
        if (!PolicyDocument.SUPPORTED_VERSIONS.contains(document.version())) {
            throw new ValidationException("version must be one of " + PolicyDocument.SUPPORTED_VERSIONS
                + ": " + document.version());
        }
        requireName(document.name(), "name");
        requireNonNull(document.rules(), "rules is required");

        for (int i = 0; i < document.rules().size(); i++) {
            validateRule(document.rules().get(i), "rules[" + i + "]");
        }
    }

    private void validateRule(PolicyRule rule, String path) {
        requireNonNull(rule, path + " cannot be null");
        requireString(rule.id(), path + ".id is required");
        if (!RULE_ID.matcher(rule.id()).matches()) {
            throw new ValidationException(path + ".id must be alphanumeric with hyphens: " + rule.id());
        }
        path = path + " (" + rule.id() + ")";
        requireName(rule.name(), path + ".name");

        for (int i = 0; i < rule.conditions().size(); i++) {
            validateCondition(rule.conditions().get(i), path + ".conditions[" + i + "]");
        }
        if (rule.conditionLogic() != null) {
            validateGroup(rule.conditionLogic(), path + ".conditionLogic");
        }
        validateAction(rule.action(), path + ".action");
    }

    private void validateGroup(ConditionGroup group, String path) {
        requireNonNull(group.operator(), path + ".operator is required");
        if (group.operandCount() == 0) {
            throw new ValidationException(path + " must contain at least one condition or group");
        }
        if (group.operator() == LogicalOperator.NOT && group.operandCount() != 1) {
            throw new ValidationException(path + " with operator not must have exactly one operand");
        }
        for (int i = 0; i < group.conditions().size(); i++) {
            validateCondition(group.conditions().get(i), path + ".conditions[" + i + "]");
        }
        for (int i = 0; i < group.groups().size(); i++) {
            validateGroup(group.groups().get(i), path + ".groups[" + i + "]");
        }
    }

    private void validateCondition(PolicyCondition condition, String path) {
        requireNonNull(condition, path + " cannot be null");
        switch (condition.kind()) {
            case COMPLEXITY -> {
                ComplexityCondition c = (ComplexityCondition) condition;
                requireNonNull(c.operator(), path + ".operator is required");
                requireRange(c.threshold(), 0, 10, path + ".threshold must be between 0 and 10");
            }
            case FILE_PATTERN -> requireNotEmpty(((FilePatternCondition) condition).patterns(),
                path + ".patterns must contain at least one pattern");
            case TIME_WINDOW -> validateTimeWindow((TimeWindowCondition) condition, path);
            case LABEL -> requireNotEmpty(((LabelCondition) condition).labels(),
                path + ".labels must contain at least one label");
            case AGENT -> {
                AgentCondition c = (AgentCondition) condition;
                requireNotEmpty(c.agents(), path + ".agents must contain at least one agent type");
                if (c.confidence() != null) {
                    requireNonNull(c.confidence().operator(), path + ".confidence.operator is required");
                    if (c.confidence().operator() == ComparisonOperator.EQ) {
                        throw new ValidationException(path + ".confidence.operator must be gt, gte, lt or lte");
                    }
                    requireRange(c.confidence().threshold(), 0, 1,
                        path + ".confidence.threshold must be between 0 and 1");
                }
            }
            case CUSTOM -> {
                CustomCondition c = (CustomCondition) condition;
                requireString(c.field(), path + ".field is required");
                requireNonNull(c.operator(), path + ".operator is required");
                if (c.operator() == CustomOperator.MATCHES) {
                    if (!(c.value() instanceof String regex)) {
                        throw new ValidationException(path + ".value must be a regex string for matches");
                    }
                    try {
                        Pattern.compile(regex);
                    } catch (PatternSyntaxException ex) {
                        throw new ValidationException(path + ".value is not a valid regex: " + ex.getDescription());
                    }
                }
                if ((c.operator() == CustomOperator.IN || c.operator() == CustomOperator.NIN)
                        && !(c.value() instanceof List<?>)) {
                    throw new ValidationException(path + ".value must be an array for " + c.operator().getValue());
                }
            }
            case AUTHOR, REPOSITORY, BRANCH -> {
                // every field is optional
            }
            case UNKNOWN -> throw new ValidationException(path + " has a missing or unrecognized condition type");
        }
    }

    private void validateTimeWindow(TimeWindowCondition condition, String path) {
        try {
            ZoneId.of(condition.timezone());
        } catch (DateTimeException ex) {
            throw new ValidationException(path + ".timezone is invalid: " + condition.timezone());
        }
        requireNotEmpty(condition.windows(), path + ".windows must contain at least one window");
        for (int i = 0; i < condition.windows().size(); i++) {
            TimeWindowCondition.Window window = condition.windows().get(i);
            String windowPath = path + ".windows[" + i + "]";
            for (String day : window.days()) {
                if (day == null || !TimeWindowCondition.DAY_NAMES.contains(day.toLowerCase())) {
                    throw new ValidationException(windowPath + ".days contains invalid day: " + day);
                }
            }
            if (window.startHour() != null) {
                requireRange(window.startHour().doubleValue(), 0, 23, windowPath + ".startHour must be between 0 and 23");
            }
            if (window.endHour() != null) {
                requireRange(window.endHour().doubleValue(), 0, 23, windowPath + ".endHour must be between 0 and 23");
            }
        }
    }

    private void validateAction(PolicyAction action, String path) {
        requireNonNull(action, path + " is required");
        requireNonNull(action.effect(), path + ".effect is required");

        ApprovalConfig approval = action.approval();
        if (approval != null) {
            if (approval.minApprovers() < 1) {
                throw new ValidationException(path + ".approval.minApprovers must be >= 1");
            }
            if (approval.timeoutHours() != null && (approval.timeoutHours() < 1 || approval.timeoutHours() > 168)) {
                throw new ValidationException(path + ".approval.timeoutHours must be between 1 and 168");
            }
        }

        NotificationConfig notification = action.notification();
        if (notification != null) {
            requireNotEmpty(notification.channels(), path + ".notification.channels must contain at least one channel");
        }
    }

    private void requireName(String value, String field) {
        requireString(value, field + " is required");
        if (value.length() > MAX_NAME_LENGTH) {
            throw new ValidationException(field + " must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ValidationException(message);
        }
    }

    private void requireNotEmpty(List<?> values, String message) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException(message);
        }
    }

    private void requireRange(Double value, double min, double max, String message) {
        if (value == null || value < min || value > max) {
            throw new ValidationException(message);
        }
    }
}
