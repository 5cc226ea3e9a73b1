package com.library.circulation.security;

import com.library.circulation.exception.ValidationException;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Already-authenticated caller identity. The engine trusts it as given.
 */
public record Actor(UUID id, Role role) {

    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    /**
     * Builds the actor from a validated access token: the subject is the user id and the
     * {@code roles} claim carries the role names. The most privileged recognised role wins;
     * a token without one is treated as a member.
     */
    public static Actor from(Jwt jwt) {
        String subject = jwt.getSubject();
        if (subject == null) {
            throw new ValidationException("Token has no subject");
        }
        UUID id;
        try {
            id = UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Token subject is not a user id: " + subject);
        }
        Role role = Role.MEMBER;
        Object rolesClaim = jwt.getClaim("roles");
        if (rolesClaim instanceof Collection<?> roles) {
            role = roles.stream()
                .map(r -> Role.parse(String.valueOf(r)))
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder())
                .orElse(Role.MEMBER);
        }
        return new Actor(id, role);
    }
}
