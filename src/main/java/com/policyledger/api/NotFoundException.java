package com.policyledger.api;

/**
 * Thrown when a policy, audit log, entry or control is requested that does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
