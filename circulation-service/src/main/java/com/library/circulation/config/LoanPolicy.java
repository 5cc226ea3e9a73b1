package com.library.circulation.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Borrowing limits, bound from {@code library.loans.*}. A non-positive limit fails startup.
 *
 * @param period    how long a loan runs before it counts as overdue
 * @param maxActive number of active loans at which further borrowing is refused
 */
@Validated
@ConfigurationProperties(prefix = "library.loans")
public record LoanPolicy(
    @NotNull @DefaultValue("14d") Duration period,
    @Positive @DefaultValue("3") int maxActive
) {

    public static final Duration DEFAULT_PERIOD = Duration.ofDays(14);
    public static final int DEFAULT_MAX_ACTIVE = 3;

    public static LoanPolicy defaults() {
        return new LoanPolicy(DEFAULT_PERIOD, DEFAULT_MAX_ACTIVE);
    }
}
