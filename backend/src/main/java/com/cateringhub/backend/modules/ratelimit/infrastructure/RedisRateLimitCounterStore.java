package com.cateringhub.backend.modules.ratelimit.infrastructure;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.cateringhub.backend.modules.ratelimit.application.RateLimitCounterStore;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Shared counter store for multi-instance deployments. The window roll-over and the increment
 * run as one Lua script, so they are atomic on the Redis server.
 */
public class RedisRateLimitCounterStore implements RateLimitCounterStore {

    static final String KEY_PREFIX = "cateringhub:rate-limit:";

    private static final String SCRIPT = """
            local now = tonumber(ARGV[1])
            local reset = tonumber(redis.call('HGET', KEYS[1], 'reset'))
            if (not reset) or now >= reset then
              reset = now + tonumber(ARGV[2])
              redis.call('DEL', KEYS[1])
              redis.call('HSET', KEYS[1], 'reset', reset)
              redis.call('PEXPIREAT', KEYS[1], reset)
            end
            local count = redis.call('HINCRBY', KEYS[1], 'count', 1)
            return {count, reset}
            """;

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> INCREMENT_SCRIPT = new DefaultRedisScript<>(SCRIPT, List.class);

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public WindowState increment(String key, Instant now, Duration window) {
        List<?> result = redisTemplate.execute(INCREMENT_SCRIPT, List.of(KEY_PREFIX + key),
                Long.toString(now.toEpochMilli()), Long.toString(window.toMillis()));
        if (result == null || result.size() != 2) {
            throw new IllegalStateException("Unexpected rate-limit script result for " + key + ": " + result);
        }
        long count = ((Number) result.get(0)).longValue();
        long resetAtMillis = ((Number) result.get(1)).longValue();
        return new WindowState(count, Instant.ofEpochMilli(resetAtMillis));
    }
}
