/**
 * Tests for CredentialManager refresh, cooldown and persistence
 *
 * @author William Callahan
 */
package com.williamcallahan.cinema_lookup.credentials;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.NetworkFailureException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.model.Credentials;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import com.williamcallahan.cinema_lookup.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialManagerTest {

    private static final String SOURCE_URL = "https://www.vprogids.nl/cinema/zoek.html";
    private static final String PAGE_WITH_CREDENTIALS =
        "<html><script>window.vpronlApiKey = 'freshkey01'; window.vpronlSecret = 'freshsecret1';</script></html>";

    @Mock
    private RateLimitedHttpClient httpClient;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final MutableClock clock = new MutableClock(Instant.parse("2030-01-01T00:00:00Z"));
    private AppConfigurationProperties.Credentials config;
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        config = new AppConfigurationProperties.Credentials();
        config.setSourceUrl(SOURCE_URL);
        config.setCooldown(Duration.ofSeconds(60));
        store = new CredentialStore(tempDir.resolve("credentials.json"), objectMapper);
    }

    private CredentialManager newManager() {
        return new CredentialManager(config, httpClient, store, RegexCredentialExtractor.defaults(),
            new MetricsService(new SimpleMeterRegistry()), clock);
    }

    @Test
    void startsWithDefaultsWhenNothingPersisted() {
        CredentialManager manager = newManager();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("ione7ahfij");
        assertThat(manager.currentCredentials().source()).isEqualTo(Credentials.DEFAULT_SOURCE);
        assertThat(manager.state()).isEqualTo(CredentialManager.State.LOADED);
    }

    @Test
    void loadsPersistedCredentials() {
        store.save(new Credentials("storedkey1", "storedsecret", clock.instant(), SOURCE_URL));

        CredentialManager manager = newManager();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("storedkey1");
        assertThat(manager.currentCredentials().apiSecret()).isEqualTo("storedsecret");
    }

    @Test
    void corruptCredentialFileFallsBackToDefaults() throws Exception {
        Files.writeString(store.getFile(), "{not json");

        CredentialManager manager = newManager();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("ione7ahfij");
    }

    @Test
    void refreshReplacesAndPersistsCredentials() {
        when(httpClient.get(eq(SOURCE_URL), any())).thenReturn(new HttpResult(200, PAGE_WITH_CREDENTIALS, null));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isTrue();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("freshkey01");
        assertThat(manager.currentCredentials().apiSecret()).isEqualTo("freshsecret1");
        assertThat(manager.state()).isEqualTo(CredentialManager.State.COOLING_DOWN);
        assertThat(store.load()).map(Credentials::apiKey).contains("freshkey01");
    }

    @Test
    void refreshWithinCooldownDoesNotFetchAgain() {
        when(httpClient.get(eq(SOURCE_URL), any())).thenReturn(new HttpResult(200, PAGE_WITH_CREDENTIALS, null));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(manager.forceRefresh()).isTrue();
        verify(httpClient, times(1)).get(eq(SOURCE_URL), any());

        clock.advance(Duration.ofSeconds(31));
        assertThat(manager.state()).isEqualTo(CredentialManager.State.LOADED);
        manager.forceRefresh();
        verify(httpClient, times(2)).get(eq(SOURCE_URL), any());
    }

    @Test
    void followsLinkedScriptsWhenPageHasNoCredentials() {
        String page = "<html><head><script src=\"/static/js/app.min.js\"></script></head><body></body></html>";
        String script = "var cfg={apiKey:\"scriptkey1\",secret:\"scriptsecret\"};";
        when(httpClient.get(eq(SOURCE_URL), any())).thenReturn(new HttpResult(200, page, null));
        when(httpClient.get(eq("https://www.vprogids.nl/static/js/app.min.js"), any()))
            .thenReturn(new HttpResult(200, script, null));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isTrue();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("scriptkey1");
        assertThat(manager.currentCredentials().apiSecret()).isEqualTo("scriptsecret");
    }

    @Test
    void unusableScriptUrlIsSkippedInFavourOfLaterScripts() {
        String page = "<html><head><script src=\"/js/app bundle.js\"></script>"
            + "<script src=\"/static/js/app.min.js\"></script></head></html>";
        String script = "var cfg={apiKey:\"scriptkey1\",secret:\"scriptsecret\"};";
        when(httpClient.get(eq(SOURCE_URL), any())).thenReturn(new HttpResult(200, page, null));
        when(httpClient.get(argThat(url -> url != null && url.contains("bundle")), any()))
            .thenThrow(new NetworkFailureException("https://www.vprogids.nl/js/app bundle.js",
                new IllegalArgumentException("Illegal character in path")));
        when(httpClient.get(eq("https://www.vprogids.nl/static/js/app.min.js"), any()))
            .thenReturn(new HttpResult(200, script, null));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isTrue();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("scriptkey1");
    }

    @Test
    void unexpectedRuntimeFailureIsReportedAsFailedRefresh() {
        when(httpClient.get(eq(SOURCE_URL), any())).thenThrow(new IllegalArgumentException("Illegal character in path"));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isFalse();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("ione7ahfij");
        assertThat(manager.state()).isEqualTo(CredentialManager.State.COOLING_DOWN);
        assertThat(manager.lastRefreshAttempt()).contains(clock.instant());
    }

    @Test
    void failedRefreshKeepsPreviousCredentials() {
        when(httpClient.get(eq(SOURCE_URL), any())).thenReturn(new HttpResult(503, "down", null));
        CredentialManager manager = newManager();

        assertThat(manager.forceRefresh()).isFalse();

        assertThat(manager.currentCredentials().apiKey()).isEqualTo("ione7ahfij");
        assertThat(manager.lastRefreshAttempt()).contains(clock.instant());
        assertThat(Files.exists(store.getFile())).isFalse();
        verify(httpClient, never()).get(eq("https://www.vprogids.nl/static/js/app.min.js"), any());
    }

    @Test
    void concurrentRefreshesShareOneFetch() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        when(httpClient.get(anyString(), any())).thenAnswer(invocation -> {
            fetchStarted.countDown();
            releaseFetch.await(5, TimeUnit.SECONDS);
            return new HttpResult(200, PAGE_WITH_CREDENTIALS, null);
        });
        CredentialManager manager = newManager();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<Boolean> first = CompletableFuture.supplyAsync(manager::forceRefresh, executor);
            assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(manager.state()).isEqualTo(CredentialManager.State.REFRESHING);

            CompletableFuture<Boolean> second = CompletableFuture.supplyAsync(manager::forceRefresh, executor);
            CompletableFuture<Boolean> third = CompletableFuture.supplyAsync(manager::forceRefresh, executor);
            releaseFetch.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(third.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        verify(httpClient, times(1)).get(anyString(), any());
    }
}
