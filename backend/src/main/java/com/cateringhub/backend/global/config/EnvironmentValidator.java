package com.cateringhub.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Validates required configuration keys once the application is ready.
 * A missing datasource, signing secret or acceptance link base fails startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "dev-jwt-secret-key-change-in-production-2025";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "cateringhub.invitations.accept-url-base",
            "cateringhub.invitations.from-address"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation completed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + key);
            }
        }

        boolean production = environment.acceptsProfiles(Profiles.of("prod"));
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (production && jwtSecret.filter(DEFAULT_DEV_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the development default with a random secret");
        }

        String store = environment.getProperty("cateringhub.rate-limit.store", "memory").trim();
        if (!store.equals("memory") && !store.equals("redis")) {
            problems.add("cateringhub.rate-limit.store: must be memory or redis, was " + store);
        }
        return problems;
    }
}
