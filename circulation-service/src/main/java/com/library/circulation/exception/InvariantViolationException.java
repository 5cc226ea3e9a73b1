package com.library.circulation.exception;

/**
 * Internal bookkeeping failure. Aborts the current transaction; never caused by valid input.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public ErrorKind getKind() {
        return ErrorKind.INVARIANT_VIOLATION;
    }
}
