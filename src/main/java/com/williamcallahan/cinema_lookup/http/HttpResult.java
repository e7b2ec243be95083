package com.williamcallahan.cinema_lookup.http;

import org.springframework.http.HttpHeaders;

/**
 * Status, body and headers of a completed HTTP exchange
 */
public record HttpResult(int status, String body, HttpHeaders headers) {

    public HttpResult {
        body = body == null ? "" : body;
        headers = headers == null ? HttpHeaders.EMPTY : headers;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
