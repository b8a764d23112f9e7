package com.policyledger.policy.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.policy.condition.ConditionExplanation;
import com.policyledger.policy.model.Effect;
import com.policyledger.policy.model.PolicyAction;

import java.util.List;

/**
 * Preview of what evaluation would decide, with every enabled rule explained.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DryRunResult(
    boolean dryRun,
    boolean wouldAllow,
    Effect wouldEffect,
    String reason,
    RuleEvaluation primaryMatch,
    List<RuleEvaluation> allRules,
    List<RuleEvaluation> matchingRules,
    List<RuleEvaluation> nonMatchingRules,
    Summary summary,
    List<String> warnings
) {

    public record RuleEvaluation(
        String ruleId,
        String ruleName,
        String policyId,
        int priority,
        boolean matched,
        List<ConditionExplanation> conditions,
        PolicyAction wouldApply
    ) {}

    public record Summary(int totalPolicies, int totalRules, int matchingRules, long evaluationTimeMs) {}
}
