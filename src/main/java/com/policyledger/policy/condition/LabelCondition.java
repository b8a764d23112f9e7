package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LabelCondition(List<String> labels, MatchType matchType) implements PolicyCondition {

    public LabelCondition {
        labels = labels == null ? List.of() : List.copyOf(labels);
        matchType = matchType == null ? MatchType.ANY : matchType;
    }

    @Override
    public ConditionType kind() {
        return ConditionType.LABEL;
    }

    public enum MatchType {
        @JsonProperty("any") ANY,
        @JsonProperty("all") ALL,
        @JsonProperty("none") NONE
    }
}
