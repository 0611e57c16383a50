package com.cateringhub.backend.global.common.time;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared UTC clock and the secure random source so invitation tokens,
 * expirations and rate-limit windows are computed from a single injectable place.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
