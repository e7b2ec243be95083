/**
 * Blocking HTTP client used by every backend of the lookup pipeline
 *
 * @author William Callahan
 *
 * Features:
 * - Takes exactly one rate limit permit per call from the target host's limiter
 * - Retries 429/5xx responses and transport failures with exponential backoff
 * - Retries POST only when the caller marks it idempotent
 * - Returns the last response once status retries are exhausted
 * - Raises NetworkFailureException for malformed URLs and once transport retries are exhausted
 */
package com.williamcallahan.cinema_lookup.http;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.exception.NetworkFailureException;
import com.williamcallahan.cinema_lookup.exception.RateLimitTimeoutException;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class RateLimitedHttpClient {

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final WebClient webClient;
    private final HostRateLimiter rateLimiter;
    private final AppConfigurationProperties.Http config;
    private final MetricsService metricsService;

    public RateLimitedHttpClient(WebClient.Builder webClientBuilder,
                                 HostRateLimiter rateLimiter,
                                 AppConfigurationProperties properties,
                                 MetricsService metricsService) {
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
        this.config = properties.getHttp();
        this.metricsService = metricsService;
    }

    public HttpResult get(String url, RequestOptions options) {
        return execute(HttpMethod.GET, url, options);
    }

    public HttpResult get(String url) {
        return execute(HttpMethod.GET, url, RequestOptions.DEFAULT);
    }

    public HttpResult post(String url, RequestOptions options) {
        return execute(HttpMethod.POST, url, options);
    }

    private HttpResult execute(HttpMethod method, String url, RequestOptions options) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new NetworkFailureException(url, e);
        }
        try {
            rateLimiter.acquire(uri.getHost());
        } catch (RateLimitTimeoutException e) {
            metricsService.incrementRateLimitTimeout();
            throw e;
        }

        boolean retryEligible = HttpMethod.GET.equals(method) || options.isIdempotent();
        Mono<HttpResult> call = exchange(method, uri, options);
        if (retryEligible && config.getMaxRetries() > 0) {
            call = call.retryWhen(Retry.backoff(config.getMaxRetries(), config.getBackoffBase())
                .filter(RateLimitedHttpClient::isTransient)
                .doBeforeRetry(retrySignal -> {
                    if (retrySignal.failure() instanceof RetryableStatusException rse) {
                        log.warn("Retrying {} {} after status {}. Attempt #{}",
                            method, url, rse.getResult().status(), retrySignal.totalRetries() + 1);
                    } else {
                        log.warn("Retrying {} {} after error: {}. Attempt #{}",
                            method, url, retrySignal.failure().toString(), retrySignal.totalRetries() + 1);
                    }
                })
                .onRetryExhaustedThrow((retryBackoffSpec, retrySignal) -> {
                    log.error("All retries failed for {} {}: {}", method, url, retrySignal.failure().toString());
                    return retrySignal.failure();
                }));
        }

        try {
            HttpResult result = call.block();
            return result != null ? result : new HttpResult(0, "", null);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof RetryableStatusException rse) {
                return rse.getResult();
            }
            if (cause instanceof LookupStageException lse) {
                throw lse;
            }
            throw new NetworkFailureException(url, cause);
        }
    }

    private Mono<HttpResult> exchange(HttpMethod method, URI uri, RequestOptions options) {
        WebClient.RequestBodySpec spec = webClient.method(method)
            .uri(uri)
            .headers(headers -> options.getHeaders().forEach(headers::set));
        WebClient.RequestHeadersSpec<?> request = options.getJsonBody() != null
            ? spec.contentType(MediaType.APPLICATION_JSON).bodyValue(options.getJsonBody())
            : spec;
        return request
            .exchangeToMono(response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new HttpResult(response.statusCode().value(), body, response.headers().asHttpHeaders())))
            .timeout(config.getRequestTimeout())
            .flatMap(result -> RETRYABLE_STATUSES.contains(result.status())
                ? Mono.<HttpResult>error(new RetryableStatusException(result))
                : Mono.just(result));
    }

    static boolean isTransient(Throwable throwable) {
        return throwable instanceof RetryableStatusException
            || throwable instanceof WebClientRequestException
            || throwable instanceof TimeoutException
            || throwable instanceof ReadTimeoutException
            || throwable instanceof PrematureCloseException
            || throwable instanceof IOException;
    }

    /**
     * Signals a retryable status inside the reactive chain; carries the response so it can be
     * returned once retries run out
     */
    static final class RetryableStatusException extends RuntimeException {
        private final transient HttpResult result;

        RetryableStatusException(HttpResult result) {
            super("Retryable HTTP status " + result.status(), null, false, false);
            this.result = result;
        }

        HttpResult getResult() {
            return result;
        }
    }
}
