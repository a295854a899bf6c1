package com.rubyast.common;

/**
 * Thrown when a tree producer breaks a structural invariant. This is a programming error:
 * it is never caught inside the library and never retried.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
