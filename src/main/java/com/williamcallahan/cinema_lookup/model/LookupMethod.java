package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage of the resolution pipeline that produced an accepted record
 */
public enum LookupMethod {
    POMS("poms"),
    TMDB_ALT("tmdb_alt"),
    WEB("web");

    private final String value;

    LookupMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
