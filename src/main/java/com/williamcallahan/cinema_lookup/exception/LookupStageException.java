/**
 * Base exception for failures inside one stage of the lookup pipeline
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so HTTP, credential and scraping layers can propagate without wrapping
 * - Caught at stage boundaries by the orchestrator and turned into "no candidate"
 */

package com.williamcallahan.cinema_lookup.exception;

public class LookupStageException extends RuntimeException {

    public LookupStageException(String message) {
        super(message);
    }

    public LookupStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
