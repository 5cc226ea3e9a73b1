package com.library.circulation.service;

import com.library.circulation.dto.BookRequest;
import com.library.circulation.dto.BookResponse;
import com.library.circulation.dto.InventorySnapshot;
import com.library.circulation.exception.ResourceNotFoundException;
import com.library.circulation.exception.ValidationException;
import com.library.circulation.model.Book;
import com.library.circulation.model.Category;
import com.library.circulation.repository.BookRepository;
import com.library.circulation.repository.CategoryRepository;
import com.library.circulation.security.Action;
import com.library.circulation.security.Actor;
import com.library.circulation.security.AuthorizationPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class BookService {

    private final BookRepository bookRepository;
    private final CategoryRepository categoryRepository;
    private final InventoryLedger inventoryLedger;
    private final AuthorizationPolicy authorizationPolicy;

    public Page<BookResponse> findAll(Boolean available, Pageable pageable) {
        Page<Book> books;
        if (available == null) {
            books = bookRepository.findAll(pageable);
        } else if (available) {
            books = bookRepository.findByAvailableCopiesGreaterThan(0, pageable);
        } else {
            books = bookRepository.findByAvailableCopies(0, pageable);
        }
        return books.map(BookResponse::from);
    }

    public Page<BookResponse> search(String query, Pageable pageable) {
        return bookRepository.search(query, pageable).map(BookResponse::from);
    }

    public BookResponse findById(UUID id) {
        return bookRepository.findById(id)
            .map(BookResponse::from)
            .orElseThrow(() -> new ResourceNotFoundException("Book not found: " + id));
    }

    /**
     * Adds a title to the catalog with every copy on the shelf.
     */
    @Transactional
    public BookResponse registerBook(Actor actor, BookRequest request) {
        authorizationPolicy.check(actor, Action.MANAGE_CATALOG);
        if (bookRepository.existsByIsbn(request.isbn())) {
            throw new ValidationException("A book with ISBN " + request.isbn() + " already exists");
        }
        Category category = null;
        if (request.categoryId() != null) {
            category = categoryRepository.findById(request.categoryId())
                .orElseThrow(() -> new ResourceNotFoundException("Category not found: " + request.categoryId()));
        }

        Book book = new Book();
        book.setTitle(request.title());
        book.setAuthor(request.author());
        book.setIsbn(request.isbn());
        book.setCategory(category);
        book.setTotalCopies(request.totalCopies());
        book.setAvailableCopies(request.totalCopies());
        Book saved = bookRepository.save(book);

        log.info("Book registered: bookId={} isbn={} copies={} actorId={}",
            saved.getId(), saved.getIsbn(), saved.getTotalCopies(), actor.id());
        return BookResponse.from(saved);
    }

    @Transactional
    public InventorySnapshot adjustTotalCopies(Actor actor, UUID bookId, int totalCopies) {
        authorizationPolicy.check(actor, Action.MANAGE_CATALOG);
        return inventoryLedger.adjustTotalCopies(bookId, totalCopies);
    }
}
