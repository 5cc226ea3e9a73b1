package com.library.circulation.dto;

public record UserLoanStats(
    long activeLoans,
    long totalLoans,
    long overdueLoans,
    boolean canBorrow
) {}
