package com.library.circulation.controller;

import com.library.circulation.dto.UserLoanStats;
import com.library.circulation.security.Actor;
import com.library.circulation.service.LoanService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserLoanController {

    private final LoanService loanService;

    @GetMapping("/{id}/loan-stats")
    public ResponseEntity<UserLoanStats> getLoanStats(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID id) {
        return ResponseEntity.ok(loanService.getUserLoanStats(Actor.from(jwt), id));
    }
}
