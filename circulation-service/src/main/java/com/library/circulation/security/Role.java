package com.library.circulation.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of roles, declared from least to most privileged. Each role owns a fixed capability set;
 * callers ask {@link AuthorizationPolicy} rather than comparing roles themselves.
 */
public enum Role {
    MEMBER(EnumSet.of(Capability.BORROW_OWN)),
    LIBRARIAN(EnumSet.of(Capability.BORROW_OWN, Capability.MANAGE_ANY_LOAN, Capability.MANAGE_CATALOG)),
    ADMIN(EnumSet.allOf(Capability.class));

    private final Set<Capability> capabilities;

    Role(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    boolean grants(Capability capability) {
        return capabilities.contains(capability);
    }

    public static Optional<Role> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
