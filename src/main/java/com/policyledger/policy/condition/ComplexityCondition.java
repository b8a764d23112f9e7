package com.policyledger.policy.condition;

/** Compares the resource complexity score (0-10) against a threshold. */
public record ComplexityCondition(ComparisonOperator operator, Double threshold) implements PolicyCondition {

    @Override
    public ConditionType kind() {
        return ConditionType.COMPLEXITY;
    }
}
