package com.library.circulation.controller;

import com.library.circulation.dto.BookRequest;
import com.library.circulation.dto.BookResponse;
import com.library.circulation.dto.CopiesUpdateRequest;
import com.library.circulation.dto.InventorySnapshot;
import com.library.circulation.security.Actor;
import com.library.circulation.service.BookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/books")
@RequiredArgsConstructor
public class BookController {

    private final BookService bookService;

    @GetMapping
    public ResponseEntity<Page<BookResponse>> listBooks(
            @RequestParam(required = false) Boolean available,
            @PageableDefault(size = 20, sort = "title") Pageable pageable) {
        return ResponseEntity.ok(bookService.findAll(available, pageable));
    }

    @GetMapping("/search")
    public ResponseEntity<Page<BookResponse>> searchBooks(
            @RequestParam String q,
            @PageableDefault(size = 20) Pageable pageable) {
        return ResponseEntity.ok(bookService.search(q, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BookResponse> getBook(@PathVariable UUID id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PostMapping
    public ResponseEntity<BookResponse> registerBook(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.registerBook(Actor.from(jwt), request));
    }

    @PutMapping("/{id}/copies")
    public ResponseEntity<InventorySnapshot> updateCopies(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID id,
            @Valid @RequestBody CopiesUpdateRequest request) {
        return ResponseEntity.ok(bookService.adjustTotalCopies(Actor.from(jwt), id, request.totalCopies()));
    }
}
