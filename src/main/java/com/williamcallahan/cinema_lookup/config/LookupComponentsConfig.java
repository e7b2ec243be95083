/**
 * Configuration class for shared lookup pipeline components
 * It handles:
 * - The clock every TTL, cooldown and timestamp decision is taken against
 * - The in-memory Caffeine cache for alternate-title lookups
 *
 * @author William Callahan
 */
package com.williamcallahan.cinema_lookup.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class LookupComponentsConfig {

    @Bean
    public Clock lookupClock() {
        return Clock.systemUTC();
    }

    @Bean
    public Cache<String, List<String>> alternateTitleCache(AppConfigurationProperties properties) {
        return Caffeine.newBuilder()
                .maximumSize(properties.getAlternate().getCacheSize())
                .expireAfterWrite(properties.getAlternate().getCacheTtl())
                .recordStats()
                .build();
    }
}
