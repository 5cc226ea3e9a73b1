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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityGuardTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private BookRepository bookRepository;

    private EligibilityGuard guard;

    private final UUID userId = UUID.randomUUID();
    private final UUID bookId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        guard = new EligibilityGuard(loanRepository, bookRepository, LoanPolicy.defaults(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void eligibleUserWithFreeCopyPasses() {
        when(bookRepository.findAvailableCopiesById(bookId)).thenReturn(Optional.of(2));
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(2L);
        when(loanRepository.existsByUserIdAndStatusAndDueDateBefore(eq(userId), eq(LoanStatus.ACTIVE), any()))
            .thenReturn(false);

        assertThatCode(() -> guard.check(userId, bookId)).doesNotThrowAnyException();
    }

    @Test
    void thirdActiveLoanBlocksFourthEvenWhenBookIsOutOfStock() {
        when(bookRepository.findAvailableCopiesById(bookId)).thenReturn(Optional.of(0));
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(3L);

        assertThatThrownBy(() -> guard.check(userId, bookId)).isInstanceOf(LoanLimitExceededException.class);
    }

    @Test
    void overdueLoanBlocksBorrowing() {
        when(bookRepository.findAvailableCopiesById(bookId)).thenReturn(Optional.of(1));
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(1L);
        when(loanRepository.existsByUserIdAndStatusAndDueDateBefore(
                userId, LoanStatus.ACTIVE, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC)))
            .thenReturn(true);

        assertThatThrownBy(() -> guard.check(userId, bookId)).isInstanceOf(OverdueLoansException.class);
    }

    @Test
    void noFreeCopyIsOutOfStock() {
        when(bookRepository.findAvailableCopiesById(bookId)).thenReturn(Optional.of(0));
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(0L);
        when(loanRepository.existsByUserIdAndStatusAndDueDateBefore(eq(userId), eq(LoanStatus.ACTIVE), any()))
            .thenReturn(false);

        assertThatThrownBy(() -> guard.check(userId, bookId)).isInstanceOf(OutOfStockException.class);
    }

    @Test
    void unknownBookIsNotFound() {
        when(bookRepository.findAvailableCopiesById(bookId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> guard.check(userId, bookId)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void statsReportBorrowingEligibility() {
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(2L);
        when(loanRepository.countByUserId(userId)).thenReturn(7L);
        lenient().when(loanRepository.countByUserIdAndStatusAndDueDateBefore(eq(userId), eq(LoanStatus.ACTIVE), any()))
            .thenReturn(0L);

        assertThat(guard.stats(userId)).isEqualTo(new UserLoanStats(2, 7, 0, true));
    }

    @Test
    void statsWithOverdueLoanCannotBorrow() {
        when(loanRepository.countByUserIdAndStatus(userId, LoanStatus.ACTIVE)).thenReturn(1L);
        when(loanRepository.countByUserId(userId)).thenReturn(1L);
        when(loanRepository.countByUserIdAndStatusAndDueDateBefore(eq(userId), eq(LoanStatus.ACTIVE), any()))
            .thenReturn(1L);

        assertThat(guard.stats(userId).canBorrow()).isFalse();
    }
}
