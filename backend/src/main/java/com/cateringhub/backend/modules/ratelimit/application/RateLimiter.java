package com.cateringhub.backend.modules.ratelimit.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;

import com.cateringhub.backend.modules.ratelimit.application.RateLimitCounterStore.WindowState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fixed-window limiter. Every check counts, including denied ones.
 */
@Service
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitCounterStore counterStore;
    private final RateLimitProperties properties;
    private final Clock clock;

    public RateLimiter(RateLimitCounterStore counterStore, RateLimitProperties properties, Clock clock) {
        this.counterStore = counterStore;
        this.properties = properties;
        this.clock = clock;
    }

    public RateLimitDecision check(String subjectId, RateLimitAction action) {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(action, "action");
        RateLimitProperties.Policy policy = properties.policyFor(action);
        Instant now = clock.instant();

        WindowState state = counterStore.increment(action.key() + ":" + subjectId, now, policy.window());

        boolean allowed = state.count() <= policy.limit();
        int remaining = (int) Math.max(0, policy.limit() - state.count());
        int retryAfter = allowed ? 0 : secondsUntil(now, state.resetAt());
        if (!allowed) {
            log.warn("Rate limit exceeded for {} on {}: {} attempts, retry in {}s",
                    subjectId, action.key(), state.count(), retryAfter);
        }
        return new RateLimitDecision(allowed, policy.limit(), remaining,
                OffsetDateTime.ofInstant(state.resetAt(), ZoneOffset.UTC), retryAfter);
    }

    private static int secondsUntil(Instant now, Instant resetAt) {
        long millis = Duration.between(now, resetAt).toMillis();
        if (millis <= 0) {
            return 0;
        }
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }
}
