package com.cateringhub.backend.modules.ratelimit.application;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window counter storage. Implementations must make {@link #increment} atomic per key.
 */
public interface RateLimitCounterStore {

    /**
     * Opens a new window when none exists or {@code now >= resetAt}, then counts one attempt.
     *
     * @return the window after the increment
     */
    WindowState increment(String key, Instant now, Duration window);

    record WindowState(long count, Instant resetAt) {
    }
}
