package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.policy.condition.PolicyCondition;

import java.util.List;

/**
 * A (priority, conditions, action) triple. When {@code conditionLogic} is set it
 * replaces the implicit AND over {@code conditions}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyRule(
    String id,
    String name,
    String description,
    Boolean enabled,
    Integer priority,
    List<PolicyCondition> conditions,
    ConditionGroup conditionLogic,
    PolicyAction action,
    List<String> tags
) {

    public PolicyRule {
        enabled = enabled == null || enabled;
        priority = priority == null ? 0 : priority;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
