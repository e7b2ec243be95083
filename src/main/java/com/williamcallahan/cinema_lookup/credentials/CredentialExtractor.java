package com.williamcallahan.cinema_lookup.credentials;

import java.util.Optional;

/**
 * Strategy for pulling a POMS key and/or secret out of page or script text.
 * Implementations are tried most specific first.
 */
public interface CredentialExtractor {

    /**
     * @param text HTML or JavaScript source
     * @return whatever part of the key pair was found, empty when neither was
     */
    Optional<ExtractedCredentials> tryExtract(String text);

    /**
     * Partial or complete key pair; either field may be null
     */
    record ExtractedCredentials(String apiKey, String apiSecret) {

        public boolean isComplete() {
            return apiKey != null && apiSecret != null;
        }

        /** Fills missing parts from {@code other}, keeping what is already known */
        public ExtractedCredentials merge(ExtractedCredentials other) {
            if (other == null) {
                return this;
            }
            return new ExtractedCredentials(
                apiKey != null ? apiKey : other.apiKey(),
                apiSecret != null ? apiSecret : other.apiSecret());
        }
    }
}
