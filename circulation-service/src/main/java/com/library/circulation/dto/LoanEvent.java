package com.library.circulation.dto;

import com.library.circulation.model.Loan;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LoanEvent(
    Type type,
    UUID loanId,
    UUID bookId,
    UUID userId,
    OffsetDateTime dueDate,
    OffsetDateTime returnDate,
    OffsetDateTime timestamp
) {
    public enum Type { LOAN_CREATED, LOAN_RETURNED }

    public static LoanEvent of(Type type, Loan loan, OffsetDateTime timestamp) {
        return new LoanEvent(
            type,
            loan.getId(),
            loan.getBook().getId(),
            loan.getUser().getId(),
            loan.getDueDate(),
            loan.getReturnDate(),
            timestamp);
    }
}
