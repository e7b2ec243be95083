/**
 * Exception thrown when a search engine answers with a bot challenge instead of results
 *
 * @author William Callahan
 *
 * Features:
 * - Carries the engine name and the DOM signature that matched
 * - Abandons that engine for the current lookup only
 */

package com.williamcallahan.cinema_lookup.exception;

public class BotProtectionDetectedException extends LookupStageException {

    private final String engine;
    private final String signature;

    public BotProtectionDetectedException(String engine, String signature) {
        super("Bot protection detected on " + engine + " (" + signature + ")");
        this.engine = engine;
        this.signature = signature;
    }

    public String getEngine() {
        return engine;
    }

    public String getSignature() {
        return signature;
    }
}
