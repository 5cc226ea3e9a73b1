package com.library.circulation.security;

public enum Capability {
    BORROW_OWN,
    MANAGE_ANY_LOAN,
    MANAGE_CATALOG,
    CHANGE_USER_ROLES
}
