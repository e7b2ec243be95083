package com.williamcallahan.cinema_lookup.http;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.NetworkFailureException;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises retry and backoff against a stubbed exchange function
 */
class RateLimitedHttpClientTest {

    private final Deque<Mono<ClientResponse>> responses = new ArrayDeque<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private RateLimitedHttpClient client;

    @BeforeEach
    void setUp() {
        AppConfigurationProperties properties = new AppConfigurationProperties();
        properties.getHttp().setBackoffBase(Duration.ofMillis(1));
        properties.getHttp().setMaxRetries(3);
        properties.getHttp().setDefaultRateLimit(new AppConfigurationProperties.RateLimit(1000.0, 100));

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            Mono<ClientResponse> next = responses.poll();
            return next != null ? next : Mono.just(response(HttpStatus.OK, "default"));
        });
        client = new RateLimitedHttpClient(builder, new HostRateLimiter(properties, RateLimiterRegistry.ofDefaults()), properties,
            new MetricsService(new SimpleMeterRegistry()));
    }

    @Test
    void retriesServiceUnavailableThenSucceeds() {
        responses.add(Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "busy")));
        responses.add(Mono.just(response(HttpStatus.OK, "ok")));

        HttpResult result = client.get("https://api.test.example/items");

        assertThat(result.status()).isEqualTo(200);
        assertThat(result.body()).isEqualTo("ok");
        assertThat(requests).hasSize(2);
    }

    @Test
    void returnsLastResponseWhenRetriesExhausted() {
        for (int i = 0; i < 4; i++) {
            responses.add(Mono.just(response(HttpStatus.TOO_MANY_REQUESTS, "slow down " + i)));
        }

        HttpResult result = client.get("https://api.test.example/items");

        assertThat(result.status()).isEqualTo(429);
        assertThat(result.body()).isEqualTo("slow down 3");
        assertThat(requests).hasSize(4);
    }

    @Test
    void doesNotRetryClientErrors() {
        responses.add(Mono.just(response(HttpStatus.NOT_FOUND, "missing")));

        HttpResult result = client.get("https://api.test.example/missing");

        assertThat(result.status()).isEqualTo(404);
        assertThat(result.isSuccess()).isFalse();
        assertThat(requests).hasSize(1);
    }

    @Test
    void doesNotRetryNonIdempotentPost() {
        responses.add(Mono.just(response(HttpStatus.BAD_GATEWAY, "bad gateway")));

        HttpResult result = client.post("https://api.test.example/items",
            RequestOptions.builder().jsonBody("{\"a\":1}").build());

        assertThat(result.status()).isEqualTo(502);
        assertThat(requests).hasSize(1);
    }

    @Test
    void retriesIdempotentPostAndSendsHeaders() {
        responses.add(Mono.just(response(HttpStatus.BAD_GATEWAY, "bad gateway")));
        responses.add(Mono.just(response(HttpStatus.OK, "{}")));

        HttpResult result = client.post("https://api.test.example/search", RequestOptions.builder()
            .header("x-npo-date", "Tue, 01 Jan 2030 00:00:00 GMT")
            .jsonBody("{\"q\":\"downfall\"}")
            .idempotent(true)
            .build());

        assertThat(result.status()).isEqualTo(200);
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).headers().getFirst("x-npo-date")).isEqualTo("Tue, 01 Jan 2030 00:00:00 GMT");
    }

    @Test
    void transportFailureBecomesNetworkFailureAfterRetries() {
        for (int i = 0; i < 4; i++) {
            responses.add(Mono.error(new IOException("connection reset")));
        }

        assertThatThrownBy(() -> client.get("https://api.test.example/flaky"))
            .isInstanceOf(NetworkFailureException.class)
            .hasRootCauseInstanceOf(IOException.class);
        assertThat(requests).hasSize(4);
    }

    @Test
    void malformedUrlBecomesNetworkFailureWithoutRequest() {
        assertThatThrownBy(() -> client.get("https://www.vprogids.nl/js/app bundle.js"))
            .isInstanceOf(NetworkFailureException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(requests).isEmpty();
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status).body(body).build();
    }
}
