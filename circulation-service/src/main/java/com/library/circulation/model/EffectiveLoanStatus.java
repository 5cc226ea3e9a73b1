package com.library.circulation.model;

import com.library.circulation.exception.ValidationException;

import java.util.Locale;

/**
 * Read-side classification of a loan. {@code OVERDUE} is never persisted.
 */
public enum EffectiveLoanStatus {
    ACTIVE,
    OVERDUE,
    RETURNED;

    public static EffectiveLoanStatus fromParam(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status filter '" + value + "'. Use: active, returned, or overdue");
        }
    }
}
