package com.cateringhub.backend.modules.membership.domain;

import java.util.Locale;

public enum MemberStatus {
    ACTIVE,
    PENDING,
    SUSPENDED,
    REMOVED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MemberStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("status code must not be blank");
        }
        return MemberStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
