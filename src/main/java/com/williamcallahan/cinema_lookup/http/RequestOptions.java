package com.williamcallahan.cinema_lookup.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-request settings for {@link RateLimitedHttpClient}
 */
@Value
@Builder
public class RequestOptions {

    public static final RequestOptions DEFAULT = RequestOptions.builder().build();

    @Singular
    Map<String, String> headers;

    /** Serialized JSON body, sent with Content-Type application/json */
    String jsonBody;

    /** POST requests are only retried when marked idempotent */
    boolean idempotent;
}
