package com.library.circulation.service;

import com.library.circulation.config.LoanPolicy;
import com.library.circulation.dto.UserLoanStats;
import com.library.circulation.exception.LoanLimitExceededException;
import com.library.circulation.exception.OutOfStockException;
import com.library.circulation.exception.OverdueLoansException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.model.LoanStatus;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Per-user borrowing rules. The counts are only trustworthy when the caller holds the borrower's row lock,
 * which {@link LoanService#createLoan} does.
 */
@Component
@RequiredArgsConstructor
public class EligibilityGuard {

    private final LoanRepository loanRepository;
    private final BookRepository bookRepository;
    private final LoanPolicy loanPolicy;
    private final Clock clock;

    /**
     * Rejects the borrow when the user is at the active-loan cap, holds an overdue loan, or the book shows no
     * free copy. The stock check is preliminary; {@link InventoryLedger#reserveCopy} decides.
     */
    public void check(UUID userId, UUID bookId) {
        int available = bookRepository.findAvailableCopiesById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + bookId));

        long active = loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE);
        if (active >= loanPolicy.maxActive()) {
            throw new LoanLimitExceededException("User already has " + loanPolicy.maxActive()
                + " active loans. Return a book before borrowing another.");
        }
        if (loanRepository.existsByUserIdAndStatusAndDueDateBefore(userId, LoanStatus.ACTIVE, now())) {
            throw new OverdueLoansException("User has overdue loans. Return them before borrowing new ones.");
        }
        if (available <= 0) {
            throw new OutOfStockException("No copies available for book: " + bookId);
        }
    }

    public UserLoanStats stats(UUID userId) {
        long active = loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE);
        long total = loanRepository.countByUserId(userId);
        long overdue = loanRepository.countByUserIdAndStatusAndDueDateBefore(userId, LoanStatus.ACTIVE, now());
        return new UserLoanStats(active, total, overdue, overdue == 0 && active < loanPolicy.maxActive());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
