package com.policyledger.policy.condition;

/**
 * Generic comparison against a request attribute. {@code field} may be a dotted
 * path into nested attribute maps.
 */
public record CustomCondition(String field, CustomOperator operator, Object value) implements PolicyCondition {

    @Override
    public ConditionType kind() {
        return ConditionType.CUSTOM;
    }
}
