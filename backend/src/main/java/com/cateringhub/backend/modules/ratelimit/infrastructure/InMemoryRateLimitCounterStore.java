package com.cateringhub.backend.modules.ratelimit.infrastructure;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import com.cateringhub.backend.modules.ratelimit.application.RateLimitCounterStore;

/**
 * Single-instance counter store. Expired windows are purged every {@code purgeInterval} increments.
 */
public class InMemoryRateLimitCounterStore implements RateLimitCounterStore {

    static final int DEFAULT_PURGE_INTERVAL = 1024;

    private final ConcurrentMap<String, WindowState> windows = new ConcurrentHashMap<>();
    private final AtomicLong increments = new AtomicLong();
    private final int purgeInterval;

    public InMemoryRateLimitCounterStore() {
        this(DEFAULT_PURGE_INTERVAL);
    }

    InMemoryRateLimitCounterStore(int purgeInterval) {
        if (purgeInterval < 1) {
            throw new IllegalArgumentException("purgeInterval must be positive");
        }
        this.purgeInterval = purgeInterval;
    }

    @Override
    public WindowState increment(String key, Instant now, Duration window) {
        WindowState state = windows.compute(key, (k, current) -> {
            if (current == null || !now.isBefore(current.resetAt())) {
                return new WindowState(1, now.plus(window));
            }
            return new WindowState(current.count() + 1, current.resetAt());
        });
        if (increments.incrementAndGet() % purgeInterval == 0) {
            purgeExpired(now);
        }
        return state;
    }

    void purgeExpired(Instant now) {
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt()));
    }

    int size() {
        return windows.size();
    }
}
