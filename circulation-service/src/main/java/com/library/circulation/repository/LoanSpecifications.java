package com.library.circulation.repository;

import com.library.circulation.model.EffectiveLoanStatus;
import com.library.circulation.model.Loan;
import com.library.circulation.model.LoanStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Filters for loan listings. Overdue is expressed as a predicate over stored columns.
 */
public final class LoanSpecifications {

    private LoanSpecifications() {
    }

    public static Specification<Loan> all() {
        return (root, query, cb) -> cb.conjunction();
    }

    public static Specification<Loan> forUser(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }

    public static Specification<Loan> forBook(UUID bookId) {
        return (root, query, cb) -> cb.equal(root.get("book").get("id"), bookId);
    }

    public static Specification<Loan> withStatus(LoanStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Loan> overdueAt(OffsetDateTime now) {
        return withStatus(LoanStatus.ACTIVE)
            .and((root, query, cb) -> cb.lessThan(root.get("dueDate"), now));
    }

    public static Specification<Loan> withEffectiveStatus(EffectiveLoanStatus status, OffsetDateTime now) {
        return switch (status) {
            case OVERDUE -> overdueAt(now);
            case ACTIVE -> withStatus(LoanStatus.ACTIVE);
            case RETURNED -> withStatus(LoanStatus.RETURNED);
        };
    }
}
