package com.williamcallahan.cinema_lookup.service.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the disk cache for the admin endpoint
 *
 * @param expiredEntries entries past their TTL that have not been read (and removed) yet
 */
public record CacheStats(
    @JsonProperty("total_entries") int totalEntries,
    @JsonProperty("found_entries") int foundEntries,
    @JsonProperty("not_found_entries") int notFoundEntries,
    @JsonProperty("expired_entries") int expiredEntries,
    @JsonProperty("total_size_bytes") long totalSizeBytes,
    @JsonProperty("max_entries") int maxEntries,
    @JsonProperty("max_size_bytes") long maxSizeBytes
) {
}
