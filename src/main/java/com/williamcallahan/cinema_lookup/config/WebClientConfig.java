/**
 * Configuration for WebClient
 * - Defines the shared WebClient builder used by every outbound call
 * - Sets up timeouts and per-host connection pooling
 *
 * @author William Callahan
 */
package com.williamcallahan.cinema_lookup.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Pools connections per remote host
 * - Applies a browser-like User-Agent, since the scraped sites reject bare clients
 */
@Configuration
public class WebClientConfig {

    /**
     * Connection pool shared by all outbound calls, bounded per remote host
     *
     * @param properties application configuration
     * @return the Reactor Netty connection provider
     */
    @Bean(destroyMethod = "dispose")
    public ConnectionProvider lookupConnectionProvider(AppConfigurationProperties properties) {
        return ConnectionProvider.builder("cinema-lookup")
            .maxConnections(properties.getHttp().getMaxConnectionsPerHost())
            .maxIdleTime(Duration.ofSeconds(30))
            .pendingAcquireTimeout(Duration.ofSeconds(30))
            .build();
    }

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts from app.http.request-timeout
     *
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(ConnectionProvider lookupConnectionProvider,
                                              AppConfigurationProperties properties) {
        Duration timeout = properties.getHttp().getRequestTimeout();
        HttpClient httpClient = HttpClient.create(lookupConnectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .followRedirect(true)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            )
            .responseTimeout(timeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getHttp().getUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
