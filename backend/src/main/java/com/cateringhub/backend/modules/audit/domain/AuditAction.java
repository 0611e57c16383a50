package com.cateringhub.backend.modules.audit.domain;

import java.util.Locale;

public enum AuditAction {
    INVITATION_SENT,
    INVITATION_RESENT,
    INVITATION_ACCEPTED,
    INVITATION_REVOKED,
    MEMBER_ROLE_UPDATED,
    MEMBER_SUSPENDED,
    MEMBER_ACTIVATED,
    MEMBER_REMOVED,
    OWNER_PROVISIONED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditAction fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("action code must not be blank");
        }
        return AuditAction.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
