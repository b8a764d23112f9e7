package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-condition breakdown reported by dry-run evaluation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionExplanation(
    ConditionType type,
    boolean matched,
    Object actualValue,
    Object expectedValue,
    String explanation
) {}
