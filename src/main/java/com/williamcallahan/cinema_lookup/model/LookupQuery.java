package com.williamcallahan.cinema_lookup.model;

import com.williamcallahan.cinema_lookup.util.LookupKeys;
import com.williamcallahan.cinema_lookup.util.TextUtils;

/**
 * Validated input of a single lookup
 *
 * @param title title as supplied by the caller, trimmed
 * @param year release year, or null when unknown
 * @param mediaType film or series, film when not supplied
 * @param externalId normalized IMDB id; ids embedded in URLs, Plex GUIDs or file names
 *                   ({@code imdb://tt0363163}) are extracted, anything else is dropped to null
 */
public record LookupQuery(String title, Integer year, MediaType mediaType, String externalId) {

    public LookupQuery {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be blank");
        }
        title = title.trim();
        mediaType = mediaType == null ? MediaType.FILM : mediaType;
        String normalizedId = TextUtils.normalizeImdbId(externalId);
        externalId = normalizedId != null ? normalizedId : TextUtils.extractImdbId(externalId);
    }

    public static LookupQuery of(String title, Integer year, MediaType mediaType, String externalId) {
        return new LookupQuery(title, year, mediaType, externalId);
    }

    public String lookupKey() {
        return LookupKeys.of(title, year, externalId, mediaType);
    }

    public boolean hasExternalId() {
        return externalId != null;
    }
}
