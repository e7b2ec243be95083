package com.williamcallahan.cinema_lookup.service.cache;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.model.CacheRecord;
import com.williamcallahan.cinema_lookup.model.CacheStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-to-live per cache status; not_found records expire sooner so misses get retried
 */
@Component
public class CacheTtlPolicy {

    private final Duration foundTtl;
    private final Duration notFoundTtl;

    @Autowired
    public CacheTtlPolicy(AppConfigurationProperties properties) {
        this(properties.getCache().getFoundTtl(), properties.getCache().getNotFoundTtl());
    }

    public CacheTtlPolicy(Duration foundTtl, Duration notFoundTtl) {
        this.foundTtl = foundTtl;
        this.notFoundTtl = notFoundTtl;
    }

    public Duration ttlFor(CacheStatus status) {
        return status == CacheStatus.FOUND ? foundTtl : notFoundTtl;
    }

    public boolean isExpired(CacheRecord record, Instant now) {
        return record.fetchedAt().plus(ttlFor(record.status())).isBefore(now);
    }
}
