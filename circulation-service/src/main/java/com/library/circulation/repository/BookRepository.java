package com.library.circulation.repository;

import com.library.circulation.model.Book;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface BookRepository extends JpaRepository<Book, UUID> {

    @Query("""
        SELECT b FROM Book b
        WHERE LOWER(b.title) LIKE LOWER(CONCAT('%', :q, '%'))
           OR LOWER(b.author) LIKE LOWER(CONCAT('%', :q, '%'))
           OR b.isbn = :q
        """)
    Page<Book> search(@Param("q") String query, Pageable pageable);

    Page<Book> findByAvailableCopiesGreaterThan(int copies, Pageable pageable);

    Page<Book> findByAvailableCopies(int copies, Pageable pageable);

    boolean existsByIsbn(String isbn);

    /**
     * Unlocked read of the counter, used for the preliminary stock check. Returns a scalar so the
     * book entity is not pulled into the persistence context ahead of the locked read.
     */
    @Query("SELECT b.availableCopies FROM Book b WHERE b.id = :id")
    Optional<Integer> findAvailableCopiesById(@Param("id") UUID id);
}
