package com.library.circulation.service;

import com.library.circulation.dto.InventorySnapshot;
import com.library.circulation.exception.InvariantViolationException;
import com.library.circulation.exception.OutOfStockException;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.ValidationException;
import com.library.circulation.model.Book;
import com.library.circulation.model.LoanStatus;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.LoanRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Owns the copy counters of every book. Each mutation runs under a {@code SELECT ... FOR UPDATE} lock on the
 * book row, so operations on one book are serialized while different books proceed in parallel.
 * The lock is held until the enclosing transaction ends; when a borrow or return calls in, that is the
 * borrow or return transaction itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryLedger {

    private final BookRepository bookRepository;
    private final LoanRepository loanRepository;
    private final EntityManager entityManager;

    /**
     * Takes one copy. The availability check and the decrement happen under the same row lock.
     *
     * @throws OutOfStockException       when no copy is free
     * @throws ResourceNotFoundException when the book does not exist
     */
    @Transactional
    public InventorySnapshot reserveCopy(UUID bookId) {
        Book book = lockBook(bookId);
        if (book.getAvailableCopies() <= 0) {
            log.warn("Reservation refused, no free copies: bookId={} total={}", bookId, book.getTotalCopies());
            throw new OutOfStockException("No copies available for book: " + bookId);
        }
        book.setAvailableCopies(book.getAvailableCopies() - 1);
        return InventorySnapshot.of(book);
    }

    /**
     * Puts one copy back.
     *
     * @throws InvariantViolationException when every copy is already on the shelf
     */
    @Transactional
    public InventorySnapshot releaseCopy(UUID bookId) {
        Book book = lockBook(bookId);
        if (book.getAvailableCopies() >= book.getTotalCopies()) {
            log.error("Release would exceed total copies: bookId={} available={} total={}",
                bookId, book.getAvailableCopies(), book.getTotalCopies());
            throw new InvariantViolationException("Release would exceed total copies for book: " + bookId);
        }
        book.setAvailableCopies(book.getAvailableCopies() + 1);
        return InventorySnapshot.of(book);
    }

    /**
     * Changes the number of owned copies. Copies currently on loan are counted from the loan table; an edit
     * that would leave fewer copies than are on loan is rejected rather than clamped.
     */
    @Transactional
    public InventorySnapshot adjustTotalCopies(UUID bookId, int newTotal) {
        if (newTotal < 0) {
            throw new ValidationException("Total copies must not be negative");
        }
        Book book = lockBook(bookId);
        long onLoan = loanRepository.countByBookIdAndStatus(bookId, LoanStatus.ACTIVE);
        if (onLoan != book.copiesOnLoan()) {
            log.error("Ledger diverged from loans: bookId={} available={} total={} activeLoans={}",
                bookId, book.getAvailableCopies(), book.getTotalCopies(), onLoan);
            throw new InvariantViolationException("Copy counters out of step with loans for book: " + bookId);
        }
        if (newTotal < onLoan) {
            throw new ValidationException(
                "Cannot set total copies to " + newTotal + ": " + onLoan + " copies are on loan");
        }
        book.setTotalCopies(newTotal);
        book.setAvailableCopies((int) (newTotal - onLoan));
        log.info("Total copies changed: bookId={} total={} available={}", bookId, newTotal, book.getAvailableCopies());
        return InventorySnapshot.of(book);
    }

    @Transactional(readOnly = true)
    public InventorySnapshot snapshot(UUID bookId) {
        return bookRepository.findById(bookId)
            .map(InventorySnapshot::of)
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + bookId));
    }

    // refresh re-reads the row under the lock even if a stale copy is already in the persistence context
    private Book lockBook(UUID bookId) {
        Book book = bookRepository.findById(bookId)
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + bookId));
        entityManager.refresh(book, LockModeType.PESSIMISTIC_WRITE);
        return book;
    }
}
