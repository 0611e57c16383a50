package com.cateringhub.backend.modules.ratelimit.application;

import java.time.OffsetDateTime;

/**
 * Outcome of one counted attempt. {@code retryAfterSeconds} is zero when the attempt is allowed.
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        int remaining,
        OffsetDateTime resetAt,
        int retryAfterSeconds
) {
}
