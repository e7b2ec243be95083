/**
 * Service for tracking lookup pipeline metrics
 * Provides counters and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.cinema_lookup.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter authRejections;
    private final Counter credentialRefreshSuccesses;
    private final Counter credentialRefreshFailures;
    private final Counter botProtectionDetections;
    private final Counter rateLimitTimeouts;

    // Timers
    private final Timer lookupTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cacheHits = Counter.builder("lookup.cache.hits")
            .description("Number of lookups answered from the disk cache")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("lookup.cache.misses")
            .description("Number of lookups that missed the disk cache")
            .register(meterRegistry);

        this.authRejections = Counter.builder("poms.auth.rejections")
            .description("Number of POMS requests rejected with 401/403")
            .register(meterRegistry);

        this.credentialRefreshSuccesses = Counter.builder("credentials.refresh")
            .tag("outcome", "success")
            .description("Credential refresh attempts")
            .register(meterRegistry);

        this.credentialRefreshFailures = Counter.builder("credentials.refresh")
            .tag("outcome", "failure")
            .description("Credential refresh attempts")
            .register(meterRegistry);

        this.botProtectionDetections = Counter.builder("web.bot_protection.detections")
            .description("Number of search engine responses recognized as bot challenges")
            .register(meterRegistry);

        this.rateLimitTimeouts = Counter.builder("http.rate_limit.timeouts")
            .description("Number of requests abandoned waiting for a rate limit permit")
            .register(meterRegistry);

        this.lookupTimer = Timer.builder("lookup.duration")
            .description("End-to-end lookup duration")
            .register(meterRegistry);
    }

    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementAuthRejection() {
        authRejections.increment();
    }

    public void recordCredentialRefresh(boolean success) {
        (success ? credentialRefreshSuccesses : credentialRefreshFailures).increment();
    }

    public void incrementBotProtectionDetection(String engine) {
        botProtectionDetections.increment();
        meterRegistry.counter("web.bot_protection.detections.by_engine", "engine", engine).increment();
    }

    public void incrementRateLimitTimeout() {
        rateLimitTimeouts.increment();
    }

    /**
     * Counts a finished lookup by its outcome and the stage that produced it
     *
     * @param status found or not_found
     * @param method poms, tmdb_alt, web, cache or none
     */
    public void recordLookup(String status, String method) {
        meterRegistry.counter("lookup.results", "status", status, "method", method).increment();
    }

    // Timer methods
    public Timer.Sample startLookupTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopLookupTimer(Timer.Sample sample) {
        sample.stop(lookupTimer);
    }
}
