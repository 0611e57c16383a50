package com.cateringhub.backend.modules.membership.domain;

import java.util.Locale;

/**
 * Membership roles. Their ordering lives in {@link RoleHierarchy}, not in the enum.
 */
public enum MemberRole {
    OWNER,
    ADMIN,
    MANAGER,
    STAFF,
    VIEWER;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an external role code such as {@code "staff"}.
     *
     * @throws IllegalArgumentException when the code is blank or unknown
     */
    public static MemberRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("role code must not be blank");
        }
        return MemberRole.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
