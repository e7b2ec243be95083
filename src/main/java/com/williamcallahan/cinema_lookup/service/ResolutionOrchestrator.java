/**
 * Orchestrates a synopsis lookup across the cache and the three backends
 *
 * @author William Callahan
 *
 * Features:
 * - Disk cache short circuit, found and not_found alike
 * - POMS search with a single credential refresh and retry on auth rejection
 * - TMDB alternate titles (or a discovered IMDB id) retried against POMS
 * - Web search and cinema.nl scrape as the final fallback
 * - Every outcome persisted, so repeated lookups are idempotent
 * - Async variant on the lookup executor, cancellable between stages
 */
package com.williamcallahan.cinema_lookup.service;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.credentials.CredentialManager;
import com.williamcallahan.cinema_lookup.exception.AuthRejectedException;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.model.CacheRecord;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.LookupMethod;
import com.williamcallahan.cinema_lookup.model.LookupQuery;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import com.williamcallahan.cinema_lookup.service.cache.DiskCacheService;
import com.williamcallahan.cinema_lookup.service.web.WebFallbackResolver;
import com.williamcallahan.cinema_lookup.util.ExternalApiLogger;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

@Slf4j
@Service
public class ResolutionOrchestrator {

    private final DiskCacheService diskCache;
    private final PrimaryApiClient primaryApiClient;
    private final AlternateTitleResolver alternateTitleResolver;
    private final WebFallbackResolver webFallbackResolver;
    private final CredentialManager credentialManager;
    private final MetricsService metricsService;
    private final AsyncTaskExecutor lookupTaskExecutor;
    private final Clock clock;
    private final int maxAlternateTitles;

    /**
     * Per-lookup mutable state; a lookup runs on a single thread
     */
    private static final class LookupState {
        private boolean authRetryUsed;
        private String discoveredExternalId;
    }

    public ResolutionOrchestrator(DiskCacheService diskCache,
                                  PrimaryApiClient primaryApiClient,
                                  AlternateTitleResolver alternateTitleResolver,
                                  WebFallbackResolver webFallbackResolver,
                                  CredentialManager credentialManager,
                                  MetricsService metricsService,
                                  @Qualifier("lookupTaskExecutor") AsyncTaskExecutor lookupTaskExecutor,
                                  Clock clock,
                                  AppConfigurationProperties properties) {
        this.diskCache = diskCache;
        this.primaryApiClient = primaryApiClient;
        this.alternateTitleResolver = alternateTitleResolver;
        this.webFallbackResolver = webFallbackResolver;
        this.credentialManager = credentialManager;
        this.metricsService = metricsService;
        this.lookupTaskExecutor = lookupTaskExecutor;
        this.clock = clock;
        this.maxAlternateTitles = properties.getAlternate().getMaxTitles();
    }

    /**
     * Resolves a synopsis, blocking until every needed stage has run
     *
     * @param title title to look up; must not be blank
     * @param year release year, or null
     * @param mediaType film or series; film when null
     * @param externalId IMDB id, or null; malformed ids are ignored
     * @return the cached or freshly persisted record, found or not_found
     * @throws IllegalArgumentException when the title is blank
     */
    public CacheRecord resolve(String title, Integer year, MediaType mediaType, String externalId) {
        return resolve(LookupQuery.of(title, year, mediaType, externalId), () -> false);
    }

    /**
     * Runs {@link #resolve} on the lookup executor. Cancelling the returned future abandons the
     * lookup at the next stage boundary; an abandoned lookup persists nothing.
     *
     * @throws IllegalArgumentException when the title is blank
     */
    public CompletableFuture<CacheRecord> resolveAsync(String title, Integer year, MediaType mediaType, String externalId) {
        LookupQuery query = LookupQuery.of(title, year, mediaType, externalId);
        CompletableFuture<CacheRecord> future = new CompletableFuture<>();
        lookupTaskExecutor.execute(() -> {
            if (future.isCancelled()) {
                return;
            }
            try {
                future.complete(resolve(query, future::isCancelled));
            } catch (CancellationException e) {
                log.info("Lookup for '{}' abandoned: {}", query.title(), e.getMessage());
                future.cancel(false);
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    CacheRecord resolve(LookupQuery query, BooleanSupplier cancelled) {
        String key = query.lookupKey();
        Timer.Sample sample = metricsService.startLookupTimer();
        long started = System.currentTimeMillis();
        ExternalApiLogger.logLookupStart(log, query.title(), query.year(), query.externalId(), query.mediaType().getValue());

        Optional<CacheRecord> cached = diskCache.read(key);
        if (cached.isPresent()) {
            metricsService.incrementCacheHit();
            CacheRecord record = cached.get();
            log.info("Cache hit for {} ({})", key, record.status().getValue());
            finish(query, record, "cache", sample, started);
            return record;
        }
        metricsService.incrementCacheMiss();

        LookupState state = new LookupState();
        ensureActive(cancelled, key, "primary");
        Optional<Candidate> candidate = primarySearch(query.title(), query, query.externalId(), state, "primary");
        LookupMethod method = LookupMethod.POMS;

        if (candidate.isEmpty()) {
            ensureActive(cancelled, key, "alternate");
            candidate = alternateTitleSearch(query, state, cancelled);
            method = LookupMethod.TMDB_ALT;
        }

        if (candidate.isEmpty()) {
            ensureActive(cancelled, key, "web");
            candidate = webSearch(query, state);
            method = LookupMethod.WEB;
        }

        ensureActive(cancelled, key, "persist");
        CacheRecord record = candidate.isPresent()
            ? CacheRecord.found(query, candidate.get(), method, state.discoveredExternalId, clock.instant())
            : CacheRecord.notFound(query, state.discoveredExternalId, clock.instant());
        if (!diskCache.write(key, record)) {
            log.warn("Lookup result for {} could not be cached; returning it anyway", key);
        }
        finish(query, record, record.isFound() ? method.getValue() : "none", sample, started);
        return record;
    }

    private Optional<Candidate> primarySearch(String title, LookupQuery query, String externalId,
                                              LookupState state, String stage) {
        try {
            return primaryApiClient.search(title, query.year(), query.mediaType(), externalId);
        } catch (AuthRejectedException e) {
            metricsService.incrementAuthRejection();
            if (state.authRetryUsed) {
                log.warn("[{}] POMS rejected credentials again (HTTP {}); retry budget spent", stage, e.getStatusCode());
                return Optional.empty();
            }
            state.authRetryUsed = true;
            boolean refreshed = credentialManager.forceRefresh();
            log.warn("[{}] POMS rejected credentials (HTTP {}); refresh {}, retrying once",
                stage, e.getStatusCode(), refreshed ? "succeeded" : "did not produce new credentials");
            try {
                return primaryApiClient.search(title, query.year(), query.mediaType(), externalId);
            } catch (AuthRejectedException again) {
                metricsService.incrementAuthRejection();
                log.warn("[{}] POMS rejected refreshed credentials (HTTP {})", stage, again.getStatusCode());
                return Optional.empty();
            } catch (LookupStageException again) {
                log.warn("[{}] POMS retry for '{}' failed: {}", stage, title, again.getMessage());
                return Optional.empty();
            }
        } catch (LookupStageException e) {
            log.warn("[{}] POMS search for '{}' failed: {}", stage, title, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Candidate> alternateTitleSearch(LookupQuery query, LookupState state, BooleanSupplier cancelled) {
        if (!alternateTitleResolver.isConfigured()) {
            log.debug("[alternate] TMDB not configured, skipping");
            return Optional.empty();
        }

        String externalId = query.externalId();
        List<String> titles;
        try {
            if (externalId == null) {
                externalId = alternateTitleResolver.findExternalId(query.title(), query.year(), query.mediaType()).orElse(null);
                state.discoveredExternalId = externalId;
            }
            titles = externalId != null ? alternateTitleResolver.alternateTitles(externalId, query.mediaType()) : List.of();
        } catch (LookupStageException e) {
            log.warn("[alternate] TMDB lookup for '{}' failed: {}", query.title(), e.getMessage());
            return Optional.empty();
        }

        int attempts = 0;
        for (String alternate : titles) {
            if (attempts >= maxAlternateTitles) {
                break;
            }
            if (TextUtils.titlesMatch(alternate, query.title())) {
                continue;
            }
            ensureActive(cancelled, query.lookupKey(), "alternate");
            attempts++;
            log.info("[alternate] Trying '{}' for '{}'", alternate, query.title());
            Optional<Candidate> candidate = primarySearch(alternate, query, externalId, state, "alternate");
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private Optional<Candidate> webSearch(LookupQuery query, LookupState state) {
        String externalId = query.externalId() != null ? query.externalId() : state.discoveredExternalId;
        try {
            return webFallbackResolver.searchWeb(query.title(), query.year(), query.mediaType(), externalId);
        } catch (LookupStageException e) {
            log.warn("[web] Web fallback for '{}' failed: {}", query.title(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void ensureActive(BooleanSupplier cancelled, String key, String stage) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Lookup " + key + " cancelled before " + stage + " stage");
        }
    }

    private void finish(LookupQuery query, CacheRecord record, String method, Timer.Sample sample, long started) {
        metricsService.stopLookupTimer(sample);
        metricsService.recordLookup(record.status().getValue(), method);
        ExternalApiLogger.logLookupComplete(log, query.title(), record.status().getValue(), method,
            System.currentTimeMillis() - started);
    }
}
