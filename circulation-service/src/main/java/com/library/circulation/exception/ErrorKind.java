package com.library.circulation.exception;

/**
 * Failure kinds reported to callers. Every business-rule rejection carries exactly one of these.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    NOT_FOUND,
    OUT_OF_STOCK,
    EXCEEDS_LOAN_LIMIT,
    HAS_OVERDUE_LOANS,
    ALREADY_RETURNED,
    FORBIDDEN,
    INVARIANT_VIOLATION
}
