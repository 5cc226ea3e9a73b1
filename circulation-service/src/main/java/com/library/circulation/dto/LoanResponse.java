package com.library.circulation.dto;

import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.Loan;
import com.library.circulation.model.LoanStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LoanResponse(
    UUID id,
    UUID bookId,
    String bookTitle,
    UUID userId,
    OffsetDateTime loanDate,
    OffsetDateTime dueDate,
    OffsetDateTime returnDate,
    LoanStatus status,
    EffectiveLoanStatus effectiveStatus
) {
    public static LoanResponse from(Loan loan, OffsetDateTime now) {
        return new LoanResponse(
            loan.getId(),
            loan.getBook().getId(),
            loan.getBook().getTitle(),
            loan.getUser().getId(),
            loan.getLoanDate(),
            loan.getDueDate(),
            loan.getReturnDate(),
            loan.getStatus(),
            loan.effectiveStatusAt(now));
    }
}
