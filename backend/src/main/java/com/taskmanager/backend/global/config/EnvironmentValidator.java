package com.taskmanager.backend.global.config;

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
 * Refuses to finish startup when required settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    static final String DEV_SECRET = "dev-jwt-secret-key-change-in-production-2025-taskmanager";
    private static final long MIN_TOKEN_TTL_MILLIS = 60_000L;
    private static final long MAX_TOKEN_TTL_MILLIS = 86_400_000L;

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        if (environment.acceptsProfiles(Profiles.of("prod"))
                && DEV_SECRET.equals(environment.getProperty("jwt.secret"))) {
            throw new IllegalStateException("jwt.secret still uses the development default");
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(var + " is missing");
            }
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent() && !jwtExpiration.get().isBlank()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < MIN_TOKEN_TTL_MILLIS || expiration > MAX_TOKEN_TTL_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_TOKEN_TTL_MILLIS + " and " + MAX_TOKEN_TTL_MILLIS + " ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number of milliseconds");
            }
        }

        String cacheType = environment.getProperty("taskflow.cache.type", "memory");
        if (!"memory".equals(cacheType) && !"redis".equals(cacheType)) {
            problems.add("taskflow.cache.type must be 'memory' or 'redis'");
        }
        return problems;
    }
}
