/**
 * Exception thrown when a remote host could not be reached after all retries, or its URL was unusable
 *
 * @author William Callahan
 *
 * Features:
 * - Covers connect errors, timeouts, dropped connections and malformed URLs
 * - Raised for transport errors only once retries are exhausted
 */

package com.williamcallahan.cinema_lookup.exception;

public class NetworkFailureException extends LookupStageException {

    private final String url;

    public NetworkFailureException(String url, Throwable cause) {
        super("Network failure calling " + url + ": " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
