package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Glob match of changed files; {@code exclude} requires that no file matches. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record FilePatternCondition(List<String> patterns, MatchType matchType) implements PolicyCondition {

    public FilePatternCondition {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        matchType = matchType == null ? MatchType.INCLUDE : matchType;
    }

    @Override
    public ConditionType kind() {
        return ConditionType.FILE_PATTERN;
    }

    public enum MatchType {
        @JsonProperty("include") INCLUDE,
        @JsonProperty("exclude") EXCLUDE
    }
}
