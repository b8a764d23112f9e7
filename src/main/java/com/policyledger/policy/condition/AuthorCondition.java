package com.policyledger.policy.condition;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Matches when the actor id, any role or any team is listed. With no lists at all
 * it matches every actor.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AuthorCondition(List<String> authors, List<String> roles, List<String> teams) implements PolicyCondition {

    public AuthorCondition {
        authors = authors == null ? List.of() : List.copyOf(authors);
        roles = roles == null ? List.of() : List.copyOf(roles);
        teams = teams == null ? List.of() : List.copyOf(teams);
    }

    public boolean hasCriteria() {
        return !authors.isEmpty() || !roles.isEmpty() || !teams.isEmpty();
    }

    @Override
    public ConditionType kind() {
        return ConditionType.AUTHOR;
    }
}
