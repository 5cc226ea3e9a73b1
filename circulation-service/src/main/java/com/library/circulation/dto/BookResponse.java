package com.library.circulation.dto;

import com.library.circulation.model.Book;

import java.util.UUID;

public record BookResponse(
    UUID id,
    String title,
    String author,
    String isbn,
    UUID categoryId,
    int totalCopies,
    int availableCopies
) {
    public static BookResponse from(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getIsbn(),
            book.getCategory() != null ? book.getCategory().getId() : null,
            book.getTotalCopies(),
            book.getAvailableCopies());
    }
}
