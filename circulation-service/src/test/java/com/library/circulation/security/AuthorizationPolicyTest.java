package com.library.circulation.security;

import com.library.circulation.exception.ErrorKind;
import com.library.circulation.exception.ForbiddenException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationPolicyTest {

    private final AuthorizationPolicy policy = new AuthorizationPolicy();

    private final UUID self = UUID.randomUUID();
    private final UUID other = UUID.randomUUID();

    @ParameterizedTest
    @EnumSource(Role.class)
    void everyRoleMayBorrowAndReturnOwnLoans(Role role) {
        Actor actor = new Actor(self, role);

        assertThat(policy.authorize(actor, Action.BORROW, self)).isTrue();
        assertThat(policy.authorize(actor, Action.RETURN, self)).isTrue();
        assertThat(policy.authorize(actor, Action.VIEW_LOANS, self)).isTrue();
    }

    @Test
    void memberIsConfinedToOwnLoans() {
        Actor member = new Actor(self, Role.MEMBER);

        assertThat(policy.authorize(member, Action.BORROW, other)).isFalse();
        assertThat(policy.authorize(member, Action.RETURN, other)).isFalse();
        assertThat(policy.authorize(member, Action.VIEW_LOANS, other)).isFalse();
        assertThat(policy.authorize(member, Action.VIEW_OVERDUE_LOANS)).isFalse();
        assertThat(policy.authorize(member, Action.MANAGE_CATALOG)).isFalse();
        assertThat(policy.authorize(member, Action.CHANGE_USER_ROLE)).isFalse();
    }

    @Test
    void librarianProcessesOthersLoansAndManagesCatalogButNotRoles() {
        Actor librarian = new Actor(self, Role.LIBRARIAN);

        assertThat(policy.authorize(librarian, Action.BORROW, other)).isTrue();
        assertThat(policy.authorize(librarian, Action.RETURN, other)).isTrue();
        assertThat(policy.authorize(librarian, Action.VIEW_LOANS, other)).isTrue();
        assertThat(policy.authorize(librarian, Action.VIEW_OVERDUE_LOANS)).isTrue();
        assertThat(policy.authorize(librarian, Action.MANAGE_CATALOG)).isTrue();
        assertThat(policy.authorize(librarian, Action.CHANGE_USER_ROLE)).isFalse();
    }

    @Test
    void adminMayDoEverything() {
        Actor admin = new Actor(self, Role.ADMIN);

        for (Action action : Action.values()) {
            assertThat(policy.authorize(admin, action, other)).as(action.name()).isTrue();
        }
    }

    @Test
    void selfScopedActionWithoutOwnerIsDeniedToMembers() {
        assertThat(policy.authorize(new Actor(self, Role.MEMBER), Action.VIEW_LOANS)).isFalse();
    }

    @Test
    void checkRaisesForbidden() {
        Actor member = new Actor(self, Role.MEMBER);

        assertThatThrownBy(() -> policy.check(member, Action.RETURN, other))
            .isInstanceOf(ForbiddenException.class)
            .extracting("kind").isEqualTo(ErrorKind.FORBIDDEN);
        assertThatCode(() -> policy.check(member, Action.RETURN, self)).doesNotThrowAnyException();
    }
}
