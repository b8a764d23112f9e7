package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Requires the acting agent type to be listed. The confidence comparator only
 * applies when the request carries a confidence value.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AgentCondition(List<String> agents, Confidence confidence) implements PolicyCondition {

    public AgentCondition {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    @Override
    public ConditionType kind() {
        return ConditionType.AGENT;
    }

    public record Confidence(ComparisonOperator operator, Double threshold) {}
}
