package com.clinicflow.backend.global.ratelimit;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.rate-limit.booking")
public record RateLimitProperties(Integer maxRequests, Duration window) {

    public RateLimitProperties {
        if (maxRequests == null || maxRequests <= 0) {
            maxRequests = 30;
        }
        if (window == null || window.isZero() || window.isNegative()) {
            window = Duration.ofMinutes(1);
        }
    }
}
