package com.policyledger.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.policyledger.audit.AgentType;

import java.time.Instant;
import java.util.List;

/**
 * An agent's recorded decision: what it saw, what it chose and how that turned out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionTrace(
    String id,
    String runId,
    AgentType agentType,
    Instant timestamp,
    String tenantId,
    Inputs inputs,
    Decision decision,
    Outcome outcome
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Inputs(String prompt, List<String> contextWindow, Double complexity) {}

    public record Decision(String action, String reasoning, double confidence, List<String> alternatives) {

        public Decision {
            alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Outcome(Result result, HumanOverride humanOverride) {}

    public record HumanOverride(String userId, String reason) {}

    public enum Result {
        @JsonProperty("success") SUCCESS,
        @JsonProperty("failure") FAILURE,
        @JsonProperty("override") OVERRIDE
    }
}
