package com.library.circulation.model;

/**
 * Stored state of a loan. {@code ACTIVE} is initial, {@code RETURNED} is terminal.
 */
public enum LoanStatus {
    ACTIVE,
    RETURNED
}
