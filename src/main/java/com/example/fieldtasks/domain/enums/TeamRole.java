package com.example.fieldtasks.domain.enums;

import com.example.fieldtasks.security.Roles;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collection;

/**
 * Role of a team member, derived from identity provider group membership.
 */
@Getter
@RequiredArgsConstructor
public enum TeamRole {

    ADMIN(Roles.ADMIN_GROUP, Roles.AUTHORITY_ADMIN),
    MEMBER(Roles.MEMBER_GROUP, Roles.AUTHORITY_MEMBER);

    @JsonValue
    private final String group;
    private final String authority;

    /**
     * Admin group membership wins; everyone else is a member
     */
    public static TeamRole fromGroups(Collection<String> groups) {
        return groups != null && groups.contains(Roles.ADMIN_GROUP) ? ADMIN : MEMBER;
    }
}
