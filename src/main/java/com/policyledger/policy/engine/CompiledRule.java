package com.policyledger.policy.engine;

import com.policyledger.policy.condition.CompiledCondition;
import com.policyledger.policy.model.EvaluationRequest;
import com.policyledger.policy.model.LogicalOperator;
import com.policyledger.policy.model.PolicyRule;

import java.util.List;

/**
 * A rule with its conditions resolved to predicates, tagged with the id of the
 * document that owns it.
 */
record CompiledRule(String policyId, PolicyRule rule, List<CompiledCondition> conditions, Group logic) {

    boolean matches(EvaluationRequest request) {
        if (logic != null) {
            return logic.test(request);
        }
        for (CompiledCondition condition : conditions) {
            if (!condition.test(request)) {
                return false;
            }
        }
        return true;
    }

    String id() {
        return rule.id();
    }

    int priority() {
        return rule.priority();
    }

    record Group(LogicalOperator operator, List<CompiledCondition> conditions, List<Group> groups) {

        boolean test(EvaluationRequest request) {
            return switch (operator) {
                case AND -> conditions.stream().allMatch(c -> c.test(request))
                    && groups.stream().allMatch(g -> g.test(request));
                case OR -> conditions.stream().anyMatch(c -> c.test(request))
                    || groups.stream().anyMatch(g -> g.test(request));
                // a well-formed not has one operand; anything else negates their conjunction
                case NOT -> !(conditions.stream().allMatch(c -> c.test(request))
                    && groups.stream().allMatch(g -> g.test(request)));
            };
        }
    }
}
