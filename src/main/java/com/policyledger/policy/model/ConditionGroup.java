package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.policy.condition.PolicyCondition;

import java.util.List;

/**
 * Boolean combination of conditions and nested groups. {@code not} negates its
 * single operand.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ConditionGroup(
    LogicalOperator operator,
    List<PolicyCondition> conditions,
    List<ConditionGroup> groups
) {

    public ConditionGroup {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public int operandCount() {
        return conditions.size() + groups.size();
    }
}
