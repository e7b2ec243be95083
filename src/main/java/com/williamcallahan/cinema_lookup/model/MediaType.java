package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of work being looked up, with the spellings each backend uses for it
 */
public enum MediaType {
    FILM("film", "m", "MOVIE"),
    SERIES("series", "s", "SERIES");

    private final String value;
    private final String keySuffix;
    private final String pomsType;

    MediaType(String value, String keySuffix, String pomsType) {
        this.value = value;
        this.keySuffix = keySuffix;
        this.pomsType = pomsType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getKeySuffix() {
        return keySuffix;
    }

    public String getPomsType() {
        return pomsType;
    }

    /**
     * Lenient parser accepting the API, TMDB and lookup-key spellings
     *
     * @param raw text such as "film", "movie", "series", "tv" or "s"; null means film
     * @return the matching media type
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static MediaType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return FILM;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "film":
            case "movie":
            case "m":
                return FILM;
            case "series":
            case "serie":
            case "tv":
            case "s":
                return SERIES;
            default:
                throw new IllegalArgumentException("Unknown media type: " + raw);
        }
    }
}
