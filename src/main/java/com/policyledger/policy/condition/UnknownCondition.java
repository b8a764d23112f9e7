package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Placeholder for a condition whose type is missing or not recognized. Never matches. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UnknownCondition() implements PolicyCondition {

    @Override
    public ConditionType kind() {
        return ConditionType.UNKNOWN;
    }
}
