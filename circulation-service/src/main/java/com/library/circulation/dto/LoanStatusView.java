package com.library.circulation.dto;

import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.LoanStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LoanStatusView(
    UUID loanId,
    LoanStatus storedStatus,
    EffectiveLoanStatus effectiveStatus,
    OffsetDateTime dueDate,
    OffsetDateTime returnDate
) {}
