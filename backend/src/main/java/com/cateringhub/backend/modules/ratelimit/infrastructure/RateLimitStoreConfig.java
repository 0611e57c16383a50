package com.cateringhub.backend.modules.ratelimit.infrastructure;

import com.cateringhub.backend.modules.ratelimit.application.RateLimitCounterStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RateLimitStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "cateringhub.rate-limit.store", havingValue = "redis")
    public RateLimitCounterStore redisRateLimitCounterStore(StringRedisTemplate redisTemplate) {
        log.info("Using Redis rate-limit counter store");
        return new RedisRateLimitCounterStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "cateringhub.rate-limit.store", havingValue = "memory", matchIfMissing = true)
    public RateLimitCounterStore inMemoryRateLimitCounterStore() {
        log.info("Using in-memory rate-limit counter store");
        return new InMemoryRateLimitCounterStore();
    }
}
