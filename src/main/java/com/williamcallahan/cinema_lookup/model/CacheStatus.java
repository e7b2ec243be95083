package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CacheStatus {
    FOUND("found"),
    NOT_FOUND("not_found");

    private final String value;

    CacheStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
