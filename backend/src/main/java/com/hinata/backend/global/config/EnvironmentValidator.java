package com.hinata.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 서명/토큰 수명 설정 검증
 * 사용할 수 없거나 안전하지 않은 토큰을 만들 설정이면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final long MIN_ACCESS_TTL_MS = 60_000L;
    static final long MAX_ACCESS_TTL_MS = 86_400_000L;
    static final long MAX_REFRESH_TTL_MS = 90L * 86_400_000L;
    static final String DEV_SECRET = "dev-only-hinata-secret-change-me-before-deploying";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated: mode={}", environment.getProperty("hinata.auth.mode", "hmac"));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        requireText("spring.datasource.url", problems);

        String mode = environment.getProperty("hinata.auth.mode", "hmac").trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "hmac" -> {
                requireText("hinata.auth.secret", problems);
                String algorithm = environment.getProperty("hinata.auth.algorithm", "HS256");
                if (!List.of("HS256", "HS384", "HS512").contains(algorithm.toUpperCase(Locale.ROOT))) {
                    problems.add("hinata.auth.algorithm must be HS256, HS384 or HS512");
                }
                if (DEV_SECRET.equals(environment.getProperty("hinata.auth.secret"))) {
                    log.warn("hinata.auth.secret still uses the development placeholder");
                }
            }
            case "eddsa" -> {
                requireText("hinata.auth.private-key", problems);
                requireText("hinata.auth.public-key", problems);
            }
            default -> problems.add("hinata.auth.mode must be hmac or eddsa");
        }

        long accessTtl = readLong("hinata.auth.access-token-ttl-ms", 900_000L, problems);
        long refreshTtl = readLong("hinata.auth.refresh-token-ttl-ms", 604_800_000L, problems);
        if (accessTtl < MIN_ACCESS_TTL_MS || accessTtl > MAX_ACCESS_TTL_MS) {
            problems.add("hinata.auth.access-token-ttl-ms must be between " + MIN_ACCESS_TTL_MS + " and " + MAX_ACCESS_TTL_MS);
        }
        if (refreshTtl <= accessTtl || refreshTtl > MAX_REFRESH_TTL_MS) {
            problems.add("hinata.auth.refresh-token-ttl-ms must exceed the access TTL and be at most " + MAX_REFRESH_TTL_MS);
        }
        return problems;
    }

    private void requireText(String key, List<String> problems) {
        String value = environment.getProperty(key);
        if (value == null || value.isBlank()) {
            problems.add(key + " is required");
        }
    }

    private long readLong(String key, long defaultValue, List<String> problems) {
        String value = environment.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            problems.add(key + " must be a number");
            return defaultValue;
        }
    }
}
