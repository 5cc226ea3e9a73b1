package com.library.circulation.controller;

import com.library.circulation.dto.LoanRequest;
import com.library.circulation.dto.LoanResponse;
import com.library.circulation.dto.LoanStatusView;
import com.library.circulation.security.Actor;
import com.library.circulation.service.LoanService;
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
@RequestMapping("/loans")
@RequiredArgsConstructor
public class LoanController {

    private final LoanService loanService;

    @PostMapping
    public ResponseEntity<LoanResponse> createLoan(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody LoanRequest request) {
        Actor actor = Actor.from(jwt);
        UUID borrowerId = request.userId() != null ? request.userId() : actor.id();
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(loanService.createLoan(actor, request.bookId(), borrowerId));
    }

    @PutMapping("/{id}/return")
    public ResponseEntity<LoanResponse> returnLoan(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID id) {
        return ResponseEntity.ok(loanService.returnLoan(Actor.from(jwt), id));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<LoanStatusView> getLoanStatus(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID id) {
        return ResponseEntity.ok(loanService.getLoanStatus(Actor.from(jwt), id));
    }

    @GetMapping
    public ResponseEntity<Page<LoanResponse>> listLoans(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) UUID userId,
            @RequestParam(required = false) UUID bookId,
            @PageableDefault(size = 10) Pageable pageable) {
        return ResponseEntity.ok(loanService.listLoans(Actor.from(jwt), status, userId, bookId, pageable));
    }

    @GetMapping("/my-loans")
    public ResponseEntity<Page<LoanResponse>> myLoans(
            @AuthenticationPrincipal Jwt jwt,
            @PageableDefault(size = 10) Pageable pageable) {
        return ResponseEntity.ok(loanService.myLoans(Actor.from(jwt), pageable));
    }

    @GetMapping("/overdue")
    public ResponseEntity<Page<LoanResponse>> listOverdue(
            @AuthenticationPrincipal Jwt jwt,
            @PageableDefault(size = 10) Pageable pageable) {
        return ResponseEntity.ok(loanService.listOverdue(Actor.from(jwt), pageable));
    }
}
