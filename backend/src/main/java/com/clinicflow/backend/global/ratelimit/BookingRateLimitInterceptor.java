package com.clinicflow.backend.global.ratelimit;

import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.RetryableProblemException;
import com.clinicflow.backend.global.security.SecurityUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Caps booking writes per user and window. Reads are never limited.
 */
public class BookingRateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(BookingRateLimitInterceptor.class);
    private static final String KEY_PREFIX = "rate:booking:";

    private final SharedCounter sharedCounter;
    private final RateLimitProperties properties;

    public BookingRateLimitInterceptor(SharedCounter sharedCounter, RateLimitProperties properties) {
        this.sharedCounter = sharedCounter;
        this.properties = properties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (HttpMethod.GET.matches(request.getMethod()) || HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        UUID userId = SecurityUtils.getCurrentUserId();
        String key = KEY_PREFIX + userId;
        long count = sharedCounter.increment(key, properties.window());
        if (count > properties.maxRequests()) {
            long retryAfter = Math.max(1L, sharedCounter.timeToLive(key).toSeconds());
            log.warn("Booking rate limit exceeded user={} count={} retryAfter={}s", userId, count, retryAfter);
            throw new RetryableProblemException(ErrorCode.RATE_LIMITED,
                    "Too many booking requests; retry in " + retryAfter + "s", retryAfter);
        }
        return true;
    }
}
