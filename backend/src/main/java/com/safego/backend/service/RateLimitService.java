package com.safego.backend.service;

import com.safego.backend.config.RateLimitProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client request limits for the unauthenticated auth endpoints.
 */
@Service
public class RateLimitService {

    private final RateLimiterConfig loginConfig;
    private final RateLimiterConfig refreshConfig;
    private final Map<String, RateLimiter> loginLimiters = new ConcurrentHashMap<>();
    private final Map<String, RateLimiter> refreshLimiters = new ConcurrentHashMap<>();

    public RateLimitService(RateLimitProperties properties) {
        this.loginConfig = RateLimiterConfig.custom()
                .limitForPeriod(properties.getLogin().getLimitPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ofMillis(properties.getLogin().getTimeoutMs()))
                .build();
        this.refreshConfig = RateLimiterConfig.custom()
                .limitForPeriod(properties.getRefresh().getLimitPerMinute())
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ofMillis(properties.getRefresh().getTimeoutMs()))
                .build();
    }

    public RateLimitDecision allowLogin(String key) {
        return acquire(loginLimiters.computeIfAbsent(key, ignored -> RateLimiter.of("login-" + key, loginConfig)));
    }

    public RateLimitDecision allowRefresh(String key) {
        return acquire(refreshLimiters.computeIfAbsent(key, ignored -> RateLimiter.of("refresh-" + key, refreshConfig)));
    }

    private RateLimitDecision acquire(RateLimiter limiter) {
        if (limiter.acquirePermission()) {
            return new RateLimitDecision(true, 0);
        }
        return new RateLimitDecision(false, limiter.getRateLimiterConfig().getLimitRefreshPeriod().toSeconds());
    }

    public record RateLimitDecision(boolean allowed, long retryAfterSeconds) {
    }
}
