package com.example.fieldtasks.security;

/**
 * Role constants shared by authentication and access checks.
 *
 * <p>Group names are the identity provider's group values; authorities are the {@code ROLE_}
 * prefixed versions granted to the authenticated caller.
 */
public final class Roles {

    public static final String ADMIN_GROUP = "admin";
    public static final String MEMBER_GROUP = "member";

    public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
    public static final String AUTHORITY_MEMBER = "ROLE_MEMBER";

    private Roles() {
    }
}
