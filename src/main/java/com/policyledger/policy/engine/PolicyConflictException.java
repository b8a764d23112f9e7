package com.policyledger.policy.engine;

/**
 * A policy document declares the same rule id twice.
 */
public class PolicyConflictException extends RuntimeException {

    public PolicyConflictException(String policyId, String ruleId) {
        super("Policy " + policyId + " declares rule id " + ruleId + " more than once");
    }
}
