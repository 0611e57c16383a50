package com.cateringhub.backend.modules.ratelimit.application;

/**
 * Throttled actions. The key doubles as the policy name under {@code cateringhub.rate-limit.policies}.
 */
public enum RateLimitAction {
    INVITE("invite"),
    INVITE_RESEND("invite-resend");

    private final String key;

    RateLimitAction(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
