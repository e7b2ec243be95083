package com.williamcallahan.cinema_lookup.controller.support;

import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error payloads shared by the lookup and admin endpoints.
 * Bodies are {@code {"error": ..., "message": ...}} with the message omitted when blank.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String error, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> badRequest(String error, Throwable cause) {
        return ResponseEntity.badRequest().body(errorBody(error, cause != null ? cause.getMessage() : null));
    }

    /**
     * Strips the wrappers an async lookup adds around the stage failure that caused it
     */
    public static Throwable rootCause(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
