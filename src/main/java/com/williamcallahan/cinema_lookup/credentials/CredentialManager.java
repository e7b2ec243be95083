/**
 * Owns the POMS API credentials for the whole process
 *
 * @author William Callahan
 *
 * Features:
 * - Loads persisted credentials at construction, falling back to built-in defaults
 * - Lock-free reads of the current key pair
 * - Serialized refresh: concurrent callers share the outcome of the refresh in flight
 * - Cooldown after every refresh attempt so auth storms cannot hammer the credential page
 * - Scrapes the public search page, then its linked scripts, for the key pair
 */
package com.williamcallahan.cinema_lookup.credentials;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.credentials.CredentialExtractor.ExtractedCredentials;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.http.RequestOptions;
import com.williamcallahan.cinema_lookup.model.Credentials;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class CredentialManager {

    public enum State {
        UNINITIALIZED,
        LOADED,
        REFRESHING,
        COOLING_DOWN
    }

    private static final RequestOptions PAGE_OPTIONS = RequestOptions.builder()
        .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/javascript,*/*;q=0.8")
        .header(HttpHeaders.ACCEPT_LANGUAGE, "nl-NL,nl;q=0.9")
        .build();

    private final RateLimitedHttpClient httpClient;
    private final CredentialStore store;
    private final List<CredentialExtractor> extractors;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String sourceUrl;
    private final Duration cooldown;

    private final AtomicReference<Credentials> current = new AtomicReference<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);

    // Guards inFlight, lastAttemptAt and lastOutcome
    private final ReentrantLock refreshLock = new ReentrantLock();
    private CompletableFuture<Boolean> inFlight;
    private Instant lastAttemptAt;
    private boolean lastOutcome;

    @Autowired
    public CredentialManager(AppConfigurationProperties properties,
                             RateLimitedHttpClient httpClient,
                             CredentialStore store,
                             MetricsService metricsService,
                             Clock clock) {
        this(properties.getCredentials(), httpClient, store, RegexCredentialExtractor.defaults(), metricsService, clock);
    }

    CredentialManager(AppConfigurationProperties.Credentials config,
                      RateLimitedHttpClient httpClient,
                      CredentialStore store,
                      List<CredentialExtractor> extractors,
                      MetricsService metricsService,
                      Clock clock) {
        this.httpClient = httpClient;
        this.store = store;
        this.extractors = List.copyOf(extractors);
        this.metricsService = metricsService;
        this.clock = clock;
        this.sourceUrl = config.getSourceUrl();
        this.cooldown = config.getCooldown();

        Credentials initial = store.load().orElseGet(() -> {
            log.info("No persisted POMS credentials at {}, using defaults", store.getFile());
            return Credentials.defaults(config.getDefaultApiKey(), config.getDefaultApiSecret(), clock.instant());
        });
        current.set(initial);
        state.set(State.LOADED);
        log.info("POMS credentials loaded (key {}, source {})", initial.maskedKey(), initial.source());
    }

    /**
     * @return the credentials to sign the next request with; never null, never blocks
     */
    public Credentials currentCredentials() {
        return current.get();
    }

    /**
     * @return LOADED, REFRESHING or COOLING_DOWN
     */
    public State state() {
        State observed = state.get();
        if (observed == State.COOLING_DOWN && !withinCooldown()) {
            state.compareAndSet(State.COOLING_DOWN, State.LOADED);
            return State.LOADED;
        }
        return observed;
    }

    public Optional<Instant> lastRefreshAttempt() {
        refreshLock.lock();
        try {
            return Optional.ofNullable(lastAttemptAt);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Fetches fresh credentials unless a refresh is running or one finished within the cooldown.
     * Callers arriving during a refresh wait for it and get its outcome; callers arriving during
     * the cooldown get the previous outcome without any network traffic.
     *
     * @return true when the current credentials came from a successful refresh
     */
    public boolean forceRefresh() {
        CompletableFuture<Boolean> refresh;
        refreshLock.lock();
        try {
            if (inFlight != null) {
                refresh = inFlight;
                log.debug("Joining credential refresh already in flight");
            } else if (withinCooldown()) {
                log.debug("Credential refresh suppressed, last attempt at {} (cooldown {}s)", lastAttemptAt, cooldown.toSeconds());
                return lastOutcome;
            } else {
                inFlight = new CompletableFuture<>();
                state.set(State.REFRESHING);
                refresh = null;
            }
        } finally {
            refreshLock.unlock();
        }

        if (refresh != null) {
            return refresh.join();
        }
        return runRefresh();
    }

    private boolean runRefresh() {
        boolean outcome = false;
        try {
            outcome = fetchAndReplace();
        } catch (RuntimeException e) {
            log.warn("Credential refresh from {} failed: {}", sourceUrl, e.getMessage());
        } finally {
            CompletableFuture<Boolean> finished;
            refreshLock.lock();
            try {
                lastAttemptAt = clock.instant();
                lastOutcome = outcome;
                finished = inFlight;
                inFlight = null;
                state.set(State.COOLING_DOWN);
            } finally {
                refreshLock.unlock();
            }
            metricsService.recordCredentialRefresh(outcome);
            finished.complete(outcome);
        }
        return outcome;
    }

    private boolean fetchAndReplace() {
        log.info("Fetching fresh POMS credentials from {}", sourceUrl);
        HttpResult page = httpClient.get(sourceUrl, PAGE_OPTIONS);
        if (!page.isSuccess()) {
            log.warn("Credential page {} returned HTTP {}", sourceUrl, page.status());
            return false;
        }

        ExtractedCredentials found = extractFrom(page.body(), null);
        if (found == null || !found.isComplete()) {
            found = extractFromScripts(page.body(), found);
        }
        if (found == null || !found.isComplete()) {
            log.warn("Could not extract POMS credentials from {} or its scripts", sourceUrl);
            return false;
        }

        Credentials fresh = new Credentials(found.apiKey(), found.apiSecret(), clock.instant(), sourceUrl);
        current.set(fresh);
        if (!store.save(fresh)) {
            log.warn("Refreshed credentials are active but were not persisted");
        }
        log.info("Refreshed POMS credentials (key {})", fresh.maskedKey());
        return true;
    }

    private ExtractedCredentials extractFromScripts(String html, ExtractedCredentials partial) {
        Document document = Jsoup.parse(html, sourceUrl);
        Set<String> scriptUrls = new LinkedHashSet<>();
        for (Element script : document.select("script[src]")) {
            String src = script.absUrl("src");
            if (!src.isBlank()) {
                scriptUrls.add(src);
            }
        }
        ExtractedCredentials found = partial;
        for (String scriptUrl : scriptUrls) {
            try {
                HttpResult script = httpClient.get(scriptUrl, PAGE_OPTIONS);
                if (!script.isSuccess()) {
                    log.debug("Skipping script {} (HTTP {})", scriptUrl, script.status());
                    continue;
                }
                found = extractFrom(script.body(), found);
                if (found != null && found.isComplete()) {
                    log.debug("Found POMS credentials in {}", scriptUrl);
                    return found;
                }
            } catch (LookupStageException e) {
                log.debug("Skipping script {}: {}", scriptUrl, e.getMessage());
            }
        }
        return found;
    }

    private ExtractedCredentials extractFrom(String text, ExtractedCredentials known) {
        ExtractedCredentials found = known;
        for (CredentialExtractor extractor : extractors) {
            Optional<ExtractedCredentials> result = extractor.tryExtract(text);
            if (result.isPresent()) {
                found = found == null ? result.get() : found.merge(result.get());
                if (found.isComplete()) {
                    return found;
                }
            }
        }
        return found;
    }

    private boolean withinCooldown() {
        refreshLock.lock();
        try {
            return lastAttemptAt != null && clock.instant().isBefore(lastAttemptAt.plus(cooldown));
        } finally {
            refreshLock.unlock();
        }
    }
}
