package com.library.circulation.service;

import com.library.circulation.config.LoanPolicy;
import com.library.circulation.exception.AlreadyReturnedException;
import com.library.circulation.model.Book;
import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.Loan;
import com.library.circulation.model.LoanStatus;
import com.library.circulation.model.User;
import com.library.circulation.repository.LoanRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LoanStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);

    @Mock
    private LoanRepository loanRepository;

    @Mock
    private InventoryLedger inventoryLedger;

    private LoanStateMachine stateMachine;

    private Book book;
    private User user;

    @BeforeEach
    void setUp() {
        stateMachine = new LoanStateMachine(loanRepository, inventoryLedger, LoanPolicy.defaults(),
            Clock.fixed(NOW, ZoneOffset.UTC));
        book = new Book();
        book.setId(UUID.randomUUID());
        user = new User();
        user.setId(UUID.randomUUID());
    }

    @Test
    void createStartsActiveLoanDueInFourteenDays() {
        when(loanRepository.save(any(Loan.class))).thenAnswer(inv -> inv.getArgument(0));

        Loan loan = stateMachine.create(user, book);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.ACTIVE);
        assertThat(loan.getLoanDate()).isEqualTo(NOW_UTC);
        assertThat(loan.getDueDate()).isEqualTo(NOW_UTC.plus(Duration.ofDays(14)));
        assertThat(loan.getReturnDate()).isNull();
        assertThat(loan.getBook()).isSameAs(book);
        assertThat(loan.getUser()).isSameAs(user);
    }

    @Test
    void markReturnedClosesLoanAndReleasesCopy() {
        Loan loan = activeLoan(NOW_UTC.plusDays(3));

        stateMachine.markReturned(loan);

        assertThat(loan.getStatus()).isEqualTo(LoanStatus.RETURNED);
        assertThat(loan.getReturnDate()).isEqualTo(NOW_UTC);
        verify(inventoryLedger).releaseCopy(book.getId());
    }

    @Test
    void returningTwiceFailsWithoutReleasingAgain() {
        Loan loan = activeLoan(NOW_UTC.plusDays(3));
        loan.setStatus(LoanStatus.RETURNED);
        loan.setReturnDate(NOW_UTC.minusDays(1));

        assertThatThrownBy(() -> stateMachine.markReturned(loan)).isInstanceOf(AlreadyReturnedException.class);

        assertThat(loan.getReturnDate()).isEqualTo(NOW_UTC.minusDays(1));
        verify(inventoryLedger, never()).releaseCopy(any(UUID.class));
    }

    @Test
    void effectiveStatusUsesClock() {
        assertThat(stateMachine.effectiveStatus(activeLoan(NOW_UTC.minusHours(1)))).isEqualTo(EffectiveLoanStatus.OVERDUE);
        assertThat(stateMachine.effectiveStatus(activeLoan(NOW_UTC.plusHours(1)))).isEqualTo(EffectiveLoanStatus.ACTIVE);
    }

    private Loan activeLoan(OffsetDateTime dueDate) {
        Loan loan = new Loan();
        loan.setId(UUID.randomUUID());
        loan.setBook(book);
        loan.setUser(user);
        loan.setLoanDate(dueDate.minusDays(14));
        loan.setDueDate(dueDate);
        loan.setStatus(LoanStatus.ACTIVE);
        return loan;
    }
}
