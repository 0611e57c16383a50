package com.cateringhub.backend.modules.ratelimit.application;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cateringhub.rate-limit")
public record RateLimitProperties(
        @NotBlank String store,
        Map<String, @Valid Policy> policies
) {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";

    public RateLimitProperties {
        if (store == null || store.isBlank()) {
            store = STORE_MEMORY;
        }
        Map<String, Policy> merged = new HashMap<>();
        merged.put(RateLimitAction.INVITE.key(), new Policy(10, Duration.ofHours(1)));
        merged.put(RateLimitAction.INVITE_RESEND.key(), new Policy(3, Duration.ofHours(1)));
        if (policies != null) {
            merged.putAll(policies);
        }
        policies = Map.copyOf(merged);
    }

    public Policy policyFor(RateLimitAction action) {
        Policy policy = policies.get(action.key());
        if (policy == null) {
            throw new IllegalStateException("No rate-limit policy configured for " + action.key());
        }
        return policy;
    }

    public record Policy(
            @Positive int limit,
            @NotNull Duration window
    ) {

        public Policy {
            if (limit < 1) {
                throw new IllegalArgumentException("rate-limit limit must be positive");
            }
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("rate-limit window must be positive");
            }
        }
    }
}
