package com.library.circulation.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UuidGenerator;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One borrowing event. Never deleted; {@code returnDate} is non-null exactly when the status is RETURNED.
 */
@Entity
@Table(name = "loans")
@Getter
@Setter
public class Loan {

    @Id
    @UuidGenerator
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false, updatable = false)
    private Book book;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private User user;

    @Column(name = "loan_date", nullable = false, updatable = false)
    private OffsetDateTime loanDate;

    @Column(name = "due_date", nullable = false, updatable = false)
    private OffsetDateTime dueDate;

    @Column(name = "return_date")
    private OffsetDateTime returnDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private LoanStatus status = LoanStatus.ACTIVE;

    public boolean isActive() {
        return status == LoanStatus.ACTIVE;
    }

    public EffectiveLoanStatus effectiveStatusAt(OffsetDateTime now) {
        if (status == LoanStatus.RETURNED) {
            return EffectiveLoanStatus.RETURNED;
        }
        return dueDate.isBefore(now) ? EffectiveLoanStatus.OVERDUE : EffectiveLoanStatus.ACTIVE;
    }
}
