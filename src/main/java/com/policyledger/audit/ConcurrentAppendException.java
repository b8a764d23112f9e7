package com.policyledger.audit;

/**
 * Conditional append lost a race: the log head moved after it was read.
 */
public class ConcurrentAppendException extends RuntimeException {

    public ConcurrentAppendException(String message) {
        super(message);
    }
}
