package com.clinicflow.backend.global.config;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required key is missing or obviously misconfigured.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-clinicflow-dev-secret";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins",
            "app.queue.cleanup-retention"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment: " + String.join("; ", problems));
        }
        log.info("Environment check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + key);
            }
        }

        String secret = environment.getProperty("jwt.secret");
        if (PLACEHOLDER_SECRET.equals(secret)) {
            problems.add("jwt.secret still uses the placeholder value");
        } else if (secret != null && !secret.isBlank() && secret.length() < 32) {
            problems.add("jwt.secret must be at least 32 characters for HS256");
        }

        String retention = environment.getProperty("app.queue.cleanup-retention");
        if (retention != null && !retention.isBlank()) {
            try {
                if (Duration.parse(retention).isNegative()) {
                    problems.add("app.queue.cleanup-retention must not be negative");
                }
            } catch (DateTimeParseException ex) {
                problems.add("app.queue.cleanup-retention must be an ISO-8601 duration");
            }
        }

        String zoneId = environment.getProperty("app.clinic.zone-id");
        if (zoneId != null && !zoneId.isBlank()) {
            try {
                ZoneId.of(zoneId.trim());
            } catch (DateTimeException ex) {
                problems.add("app.clinic.zone-id must be a valid time zone id");
            }
        }
        return problems;
    }
}
