package com.library.circulation.security;

import com.library.circulation.exception.ForbiddenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Single entry point for role decisions. Denials raise {@link ForbiddenException}; data is never filtered silently.
 */
@Component
@Slf4j
public class AuthorizationPolicy {

    public boolean authorize(Actor actor, Action action, UUID resourceOwnerId) {
        Role role = actor.role();
        if (action.anyCapability() != null && role.grants(action.anyCapability())) {
            return true;
        }
        return action.ownCapability() != null
            && resourceOwnerId != null
            && actor.id().equals(resourceOwnerId)
            && role.grants(action.ownCapability());
    }

    public boolean authorize(Actor actor, Action action) {
        return authorize(actor, action, null);
    }

    public void check(Actor actor, Action action, UUID resourceOwnerId) {
        if (!authorize(actor, action, resourceOwnerId)) {
            log.warn("Denied action={} actorId={} role={} ownerId={}", action, actor.id(), actor.role(), resourceOwnerId);
            throw new ForbiddenException("Not allowed to " + describe(action));
        }
    }

    public void check(Actor actor, Action action) {
        check(actor, action, null);
    }

    private static String describe(Action action) {
        return switch (action) {
            case BORROW -> "borrow on behalf of this user";
            case RETURN -> "return this loan";
            case VIEW_LOANS -> "view loans of this user";
            case VIEW_OVERDUE_LOANS -> "view overdue loans";
            case MANAGE_CATALOG -> "manage the catalog";
            case CHANGE_USER_ROLE -> "change user roles";
        };
    }
}
