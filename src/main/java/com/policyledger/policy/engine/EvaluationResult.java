package com.policyledger.policy.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.policyledger.policy.model.Effect;

import java.time.Instant;
import java.util.List;

/**
 * Decision for one evaluation request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResult(
    boolean allowed,
    Effect effect,
    String reason,
    MatchedRule matchedRule,
    List<RequiredAction> requiredActions,
    MissingRequirements missingRequirements,
    List<String> triggeredRuleIds,
    Metadata metadata
) {

    public EvaluationResult {
        requiredActions = requiredActions == null ? List.of() : List.copyOf(requiredActions);
        triggeredRuleIds = triggeredRuleIds == null ? List.of() : List.copyOf(triggeredRuleIds);
    }

    public record MatchedRule(String id, String name, String policyId) {}

    public record RequiredAction(Type type, Object config) {

        public enum Type {
            @JsonProperty("approval") APPROVAL,
            @JsonProperty("notification") NOTIFICATION
        }
    }

    public record MissingRequirements(int approvalsNeeded, List<String> missingScopes, List<String> requiredRoles) {

        public MissingRequirements {
            missingScopes = missingScopes == null ? List.of() : List.copyOf(missingScopes);
            requiredRoles = requiredRoles == null ? List.of() : List.copyOf(requiredRoles);
        }

        public boolean satisfied() {
            return approvalsNeeded == 0 && missingScopes.isEmpty();
        }
    }

    public record Metadata(Instant evaluatedAt, long evaluationTimeMs, int rulesEvaluated, int policiesEvaluated) {}
}
