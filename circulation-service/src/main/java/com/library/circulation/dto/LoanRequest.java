package com.library.circulation.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * @param userId borrower when a librarian processes a loan for someone else; defaults to the caller
 */
public record LoanRequest(
    @NotNull UUID bookId,
    UUID userId
) {}
