/**
 * Exception thrown when the POMS API rejects the request signature (HTTP 401 or 403)
 *
 * @author William Callahan
 */

package com.williamcallahan.cinema_lookup.exception;

public class AuthRejectedException extends LookupStageException {

    private final int statusCode;

    public AuthRejectedException(int statusCode) {
        super("POMS API rejected credentials with HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
