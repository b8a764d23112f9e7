package com.policyledger.policy.condition;

/**
 * A condition cannot be turned into a predicate, for example because of an
 * invalid regex or time zone.
 */
public class ConditionCompilationException extends RuntimeException {

    public ConditionCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
