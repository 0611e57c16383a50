package com.cateringhub.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under each module's {@code infrastructure.persistence} package. Entity
 * {@code created_at}/{@code updated_at} stamps come from the same clock the services use, so an
 * invitation's {@code created_at} and its {@code expires_at} are measured against one time source.
 * Who created a row is stored explicitly by the owning service, so no auditor is registered.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.cateringhub.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = "entityTimestampProvider")
public class JpaConfig {

    @Bean
    public DateTimeProvider entityTimestampProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
