package com.library.circulation.service;

import com.library.circulation.config.LoanPolicy;
import com.library.circulation.exception.AlreadyReturnedException;
import com.library.circulation.model.Book;
import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.Loan;
import com.library.circulation.model.LoanStatus;
import com.library.circulation.model.User;
import com.library.circulation.repository.LoanRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * ACTIVE -> RETURNED, nothing else. Both transitions must run inside the caller's borrow or return transaction.
 */
@Component
@RequiredArgsConstructor
public class LoanStateMachine {

    private final LoanRepository loanRepository;
    private final InventoryLedger inventoryLedger;
    private final LoanPolicy loanPolicy;
    private final Clock clock;

    /**
     * Records a new loan. The copy must already have been reserved in the same transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan create(User user, Book book) {
        OffsetDateTime now = now();
        Loan loan = new Loan();
        loan.setUser(user);
        loan.setBook(book);
        loan.setLoanDate(now);
        loan.setDueDate(now.plus(loanPolicy.period()));
        loan.setStatus(LoanStatus.ACTIVE);
        return loanRepository.save(loan);
    }

    /**
     * Closes the loan and releases its copy. A loan already returned is rejected before anything is touched.
     *
     * @throws AlreadyReturnedException when the loan is not active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Loan markReturned(Loan loan) {
        if (!loan.isActive()) {
            throw new AlreadyReturnedException("Loan already returned: " + loan.getId());
        }
        loan.setReturnDate(now());
        loan.setStatus(LoanStatus.RETURNED);
        inventoryLedger.releaseCopy(loan.getBook().getId());
        return loan;
    }

    public EffectiveLoanStatus effectiveStatus(Loan loan) {
        return loan.effectiveStatusAt(now());
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
