package com.library.circulation.dto;

import com.library.circulation.model.Book;

import java.util.UUID;

/**
 * Copy counters of one book as committed by the ledger operation that produced it.
 */
public record InventorySnapshot(UUID bookId, int totalCopies, int availableCopies) {

    public static InventorySnapshot of(Book book) {
        return new InventorySnapshot(book.getId(), book.getTotalCopies(), book.getAvailableCopies());
    }
}
