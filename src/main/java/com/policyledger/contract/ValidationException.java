package com.policyledger.contract;

/**
 * Input rejected before any state change: a malformed policy document, audit
 * entry input or query.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
