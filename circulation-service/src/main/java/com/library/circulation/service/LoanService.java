package com.library.circulation.service;

import com.library.circulation.dto.LoanEvent;
import com.library.circulation.dto.LoanResponse;
import com.library.circulation.dto.LoanStatusView;
import com.library.circulation.dto.UserLoanStats;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.kafka.LoanEventPublisher;
import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.Loan;
import com.library.circulation.model.User;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import com.library.circulation.repository.LoanSpecifications;
import com.library.circulation.repository.UserRepository;
import com.library.circulation.security.Action;
import com.library.circulation.security.Actor;
import com.library.circulation.security.AuthorizationPolicy;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Borrow and return as single units of work, plus the loan read side.
 *
 * <p>Borrowing locks the borrower's user row, then the book row, and keeps both until commit. The user lock
 * serializes concurrent borrows by the same user, so the active-loan count read by {@link EligibilityGuard}
 * cannot go stale before the new loan is inserted. The book lock serializes reservations of the same book.
 * Locks are always taken user first, book second, which rules out lock-order deadlocks between borrows.
 *
 * <p>Returning locks the loan row, then the book row. A second return of the same loan waits for the first
 * to commit and then sees RETURNED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    static final int MAX_PAGE_SIZE = 100;

    private final AuthorizationPolicy authorizationPolicy;
    private final EligibilityGuard eligibilityGuard;
    private final InventoryLedger inventoryLedger;
    private final LoanStateMachine loanStateMachine;
    private final LoanRepository loanRepository;
    private final UserRepository userRepository;
    private final BookRepository bookRepository;
    private final LoanEventPublisher eventPublisher;
    private final EntityManager entityManager;

    @Transactional
    public LoanResponse createLoan(Actor actor, UUID bookId) {
        return createLoan(actor, bookId, actor.id());
    }

    /**
     * Borrows one copy of {@code bookId} for {@code borrowerId}. Librarians and admins may borrow on behalf of
     * another user; members only for themselves.
     */
    @Transactional
    public LoanResponse createLoan(Actor actor, UUID bookId, UUID borrowerId) {
        authorizationPolicy.check(actor, Action.BORROW, borrowerId);

        User borrower = lockUser(borrowerId);
        eligibilityGuard.check(borrowerId, bookId);
        inventoryLedger.reserveCopy(bookId);
        Loan loan = loanStateMachine.create(borrower, bookRepository.getReferenceById(bookId));

        OffsetDateTime now = loanStateMachine.now();
        eventPublisher.publishAfterCommit(LoanEvent.of(LoanEvent.Type.LOAN_CREATED, loan, now));
        log.info("Loan created: loanId={} userId={} bookId={} dueDate={} actorId={}",
            loan.getId(), borrowerId, bookId, loan.getDueDate(), actor.id());
        return LoanResponse.from(loan, now);
    }

    @Transactional
    public LoanResponse returnLoan(Actor actor, UUID loanId) {
        Loan loan = loanRepository.findById(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan not found: " + loanId));
        entityManager.refresh(loan, LockModeType.PESSIMISTIC_WRITE);
        authorizationPolicy.check(actor, Action.RETURN, loan.getUser().getId());

        loanStateMachine.markReturned(loan);

        OffsetDateTime now = loanStateMachine.now();
        eventPublisher.publishAfterCommit(LoanEvent.of(LoanEvent.Type.LOAN_RETURNED, loan, now));
        log.info("Loan returned: loanId={} userId={} bookId={} actorId={}",
            loan.getId(), loan.getUser().getId(), loan.getBook().getId(), actor.id());
        return LoanResponse.from(loan, now);
    }

    @Transactional(readOnly = true)
    public LoanStatusView getLoanStatus(Actor actor, UUID loanId) {
        Loan loan = loanRepository.findById(loanId)
            .orElseThrow(() -> new ResourceNotFoundException("Loan not found: " + loanId));
        authorizationPolicy.check(actor, Action.VIEW_LOANS, loan.getUser().getId());
        return new LoanStatusView(
            loan.getId(),
            loan.getStatus(),
            loanStateMachine.effectiveStatus(loan),
            loan.getDueDate(),
            loan.getReturnDate());
    }

    @Transactional(readOnly = true)
    public UserLoanStats getUserLoanStats(Actor actor, UUID userId) {
        authorizationPolicy.check(actor, Action.VIEW_LOANS, userId);
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }
        return eligibilityGuard.stats(userId);
    }

    /**
     * Loan listing, newest first. Callers without the manage-any-loan capability are confined to their own
     * loans; naming another user in the filter is refused.
     *
     * @param status one of active, returned, overdue, or {@code null} for all
     */
    @Transactional(readOnly = true)
    public Page<LoanResponse> listLoans(Actor actor, String status, UUID userId, UUID bookId, Pageable pageable) {
        UUID scopedUserId = userId;
        if (!authorizationPolicy.authorize(actor, Action.VIEW_LOANS)) {
            authorizationPolicy.check(actor, Action.VIEW_LOANS, userId != null ? userId : actor.id());
            scopedUserId = actor.id();
        }

        OffsetDateTime now = loanStateMachine.now();
        Specification<Loan> spec = LoanSpecifications.all();
        if (scopedUserId != null) {
            spec = spec.and(LoanSpecifications.forUser(scopedUserId));
        }
        if (bookId != null) {
            spec = spec.and(LoanSpecifications.forBook(bookId));
        }
        if (status != null && !status.isBlank()) {
            spec = spec.and(LoanSpecifications.withEffectiveStatus(EffectiveLoanStatus.fromParam(status), now));
        }
        return loanRepository.findAll(spec, page(pageable, Sort.by(Sort.Direction.DESC, "loanDate")))
            .map(loan -> LoanResponse.from(loan, now));
    }

    @Transactional(readOnly = true)
    public Page<LoanResponse> myLoans(Actor actor, Pageable pageable) {
        return listLoans(actor, null, actor.id(), null, pageable);
    }

    @Transactional(readOnly = true)
    public Page<LoanResponse> listOverdue(Actor actor, Pageable pageable) {
        authorizationPolicy.check(actor, Action.VIEW_OVERDUE_LOANS);
        OffsetDateTime now = loanStateMachine.now();
        return loanRepository.findAll(LoanSpecifications.overdueAt(now),
                page(pageable, Sort.by(Sort.Direction.ASC, "dueDate")))
            .map(loan -> LoanResponse.from(loan, now));
    }

    private User lockUser(UUID userId) {
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        entityManager.refresh(user, LockModeType.PESSIMISTIC_WRITE);
        return user;
    }

    private static Pageable page(Pageable pageable, Sort sort) {
        return PageRequest.of(pageable.getPageNumber(), Math.min(pageable.getPageSize(), MAX_PAGE_SIZE), sort);
    }
}
