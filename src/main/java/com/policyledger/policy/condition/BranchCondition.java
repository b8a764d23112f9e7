package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Exact or glob match on the target branch. {@code protected=true} additionally
 * requires the branch to be protected.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record BranchCondition(
    List<String> branches,
    List<String> patterns,
    @JsonProperty("protected") Boolean protectedOnly
) implements PolicyCondition {

    public BranchCondition {
        branches = branches == null ? List.of() : List.copyOf(branches);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    @Override
    public ConditionType kind() {
        return ConditionType.BRANCH;
    }
}
