package com.cateringhub.backend.global.error;

import java.time.OffsetDateTime;

/**
 * Carries the quota snapshot of a rejected attempt so the caller can render a concrete retry time.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;
    private final int remaining;
    private final OffsetDateTime resetAt;

    public RetryableProblemException(ErrorKind kind, String code, String detail,
                                     int retryAfterSeconds, int remaining, OffsetDateTime resetAt) {
        super(kind, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
        this.remaining = remaining;
        this.resetAt = resetAt;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public int getRemaining() {
        return remaining;
    }

    public OffsetDateTime getResetAt() {
        return resetAt;
    }
}
