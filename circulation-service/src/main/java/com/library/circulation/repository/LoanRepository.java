package com.library.circulation.repository;

import com.library.circulation.model.Loan;
import com.library.circulation.model.LoanStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface LoanRepository extends JpaRepository<Loan, UUID>, JpaSpecificationExecutor<Loan> {

    long countByUserIdAndStatus(UUID userId, LoanStatus status);

    long countByUserId(UUID userId);

    long countByUserIdAndStatusAndDueDateBefore(UUID userId, LoanStatus status, OffsetDateTime now);

    boolean existsByUserIdAndStatusAndDueDateBefore(UUID userId, LoanStatus status, OffsetDateTime now);

    long countByBookIdAndStatus(UUID bookId, LoanStatus status);

    @Override
    @EntityGraph(attributePaths = {"book", "user"})
    Page<Loan> findAll(Specification<Loan> spec, Pageable pageable);
}
