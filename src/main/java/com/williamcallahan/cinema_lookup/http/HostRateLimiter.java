/**
 * Per-host rate limiting shared by every outbound request
 *
 * @author William Callahan
 *
 * Features:
 * - One Resilience4j limiter per configured host fragment, created on first use
 * - Unlisted hosts get their own limiter with the default rate
 * - Waiting is bounded by app.http.rate-limit-wait; a request that cannot get a permit in time fails fast
 */
package com.williamcallahan.cinema_lookup.http;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.RateLimitTimeoutException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

@Slf4j
@Component
public class HostRateLimiter {

    private static final String NAME_PREFIX = "host-";

    private final AppConfigurationProperties.Http config;
    private final RateLimiterRegistry registry;

    @Autowired
    public HostRateLimiter(AppConfigurationProperties properties, RateLimiterRegistry registry) {
        this(properties.getHttp(), registry);
    }

    HostRateLimiter(AppConfigurationProperties.Http config, RateLimiterRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * Blocks until a permit for the host is available
     *
     * @param host request host, e.g. rs.poms.omroep.nl
     * @throws RateLimitTimeoutException when no permit arrives within app.http.rate-limit-wait
     */
    public void acquire(String host) {
        RateLimiter limiter = limiterFor(host);
        try {
            RateLimiter.waitForPermission(limiter);
        } catch (RequestNotPermitted e) {
            log.warn("Rate limit wait for {} exceeded {}ms", host, config.getRateLimitWait().toMillis());
            throw new RateLimitTimeoutException(host, config.getRateLimitWait());
        }
    }

    RateLimiter limiterFor(String host) {
        String normalizedHost = host == null ? "" : host.toLowerCase(Locale.ROOT);
        String key = configuredKey(normalizedHost);
        AppConfigurationProperties.RateLimit limit = config.getRateLimits().getOrDefault(key, config.getDefaultRateLimit());
        return registry.rateLimiter(NAME_PREFIX + key, () -> toLimiterConfig(key, limit));
    }

    // A token bucket of rate r and burst b releases b permits every b/r seconds
    private RateLimiterConfig toLimiterConfig(String key, AppConfigurationProperties.RateLimit limit) {
        if (limit.getRequestsPerSecond() <= 0 || limit.getBurst() < 1) {
            throw new IllegalArgumentException("Rate must be positive and burst at least 1 for " + key);
        }
        Duration refreshPeriod = Duration.ofNanos(Math.round(limit.getBurst() * 1_000_000_000d / limit.getRequestsPerSecond()));
        log.debug("Creating rate limiter '{}' at {} req/s, burst {}", key, limit.getRequestsPerSecond(), limit.getBurst());
        return RateLimiterConfig.custom()
            .limitForPeriod(limit.getBurst())
            .limitRefreshPeriod(refreshPeriod)
            .timeoutDuration(config.getRateLimitWait())
            .build();
    }

    // Longest configured fragment contained in the host wins; otherwise the host gets its own default limiter
    private String configuredKey(String host) {
        String best = null;
        for (String fragment : config.getRateLimits().keySet()) {
            if (host.contains(fragment.toLowerCase(Locale.ROOT)) && (best == null || fragment.length() > best.length())) {
                best = fragment;
            }
        }
        return best != null ? best : host;
    }
}
