/**
 * Exception thrown when a rate limit permit for a host did not become available in time
 *
 * @author William Callahan
 */

package com.williamcallahan.cinema_lookup.exception;

import java.time.Duration;

public class RateLimitTimeoutException extends LookupStageException {

    private final String host;

    public RateLimitTimeoutException(String host, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for rate limit permit for " + host);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
