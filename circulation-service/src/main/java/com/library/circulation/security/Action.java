package com.library.circulation.security;

/**
 * Operations guarded by {@link AuthorizationPolicy}. An action is allowed when the actor owns the resource
 * and holds {@code ownCapability}, or holds {@code anyCapability} regardless of ownership.
 * A {@code null} own-capability means the action has no self-scoped form.
 */
public enum Action {
    BORROW(Capability.BORROW_OWN, Capability.MANAGE_ANY_LOAN),
    RETURN(Capability.BORROW_OWN, Capability.MANAGE_ANY_LOAN),
    VIEW_LOANS(Capability.BORROW_OWN, Capability.MANAGE_ANY_LOAN),
    VIEW_OVERDUE_LOANS(null, Capability.MANAGE_ANY_LOAN),
    MANAGE_CATALOG(null, Capability.MANAGE_CATALOG),
    CHANGE_USER_ROLE(null, Capability.CHANGE_USER_ROLES);

    private final Capability ownCapability;
    private final Capability anyCapability;

    Action(Capability ownCapability, Capability anyCapability) {
        this.ownCapability = ownCapability;
        this.anyCapability = anyCapability;
    }

    Capability ownCapability() {
        return ownCapability;
    }

    Capability anyCapability() {
        return anyCapability;
    }
}
