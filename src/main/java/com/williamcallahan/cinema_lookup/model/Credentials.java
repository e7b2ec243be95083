package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * POMS API key/secret pair plus where and when it was obtained.
 * Replaced wholesale on refresh, never mutated.
 *
 * @param apiKey public API key, never blank
 * @param apiSecret HMAC signing secret, never blank
 * @param fetchedAt when the pair was obtained
 * @param source page the pair was scraped from, or "default"
 */
public record Credentials(
    @JsonProperty("api_key")
    String apiKey,

    @JsonProperty("api_secret")
    String apiSecret,

    @JsonProperty("fetched_at")
    Instant fetchedAt,

    @JsonProperty("source")
    String source
) {
    public static final String DEFAULT_SOURCE = "default";

    public Credentials {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalArgumentException("Credentials require a non-blank key and secret");
        }
    }

    public static Credentials defaults(String apiKey, String apiSecret, Instant now) {
        return new Credentials(apiKey, apiSecret, now, DEFAULT_SOURCE);
    }

    /** Key with the middle masked, for logs and the admin endpoint */
    public String maskedKey() {
        if (apiKey.length() <= 4) {
            return "****";
        }
        return apiKey.substring(0, 2) + "****" + apiKey.substring(apiKey.length() - 2);
    }
}
