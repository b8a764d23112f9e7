package com.policyledger.policy.condition;

import com.policyledger.policy.model.EvaluationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * A condition bound to its precompiled predicate. Evaluation never throws; a
 * predicate failure is logged and counts as no match.
 */
public record CompiledCondition(PolicyCondition source, Predicate<EvaluationRequest> predicate) {

    private static final Logger log = LoggerFactory.getLogger(CompiledCondition.class);

    public boolean test(EvaluationRequest request) {
        try {
            return predicate.test(request);
        } catch (RuntimeException ex) {
            log.warn("{} condition failed to evaluate, treating as no match: {}",
                source == null ? "unknown" : source.kind().getValue(), ex.toString());
            return false;
        }
    }
}
