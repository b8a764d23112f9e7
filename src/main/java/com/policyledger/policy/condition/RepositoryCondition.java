package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Exact names match either {@code owner/name} or the bare name; globs match
 * {@code owner/name}. No names and no globs matches any repository.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RepositoryCondition(List<String> repos, List<String> patterns) implements PolicyCondition {

    public RepositoryCondition {
        repos = repos == null ? List.of() : List.copyOf(repos);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    @Override
    public ConditionType kind() {
        return ConditionType.REPOSITORY;
    }
}
