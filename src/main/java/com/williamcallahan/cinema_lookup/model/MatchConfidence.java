package com.williamcallahan.cinema_lookup.model;

/**
 * How a candidate was (or would be) accepted, strongest first
 */
public enum MatchConfidence {
    /** Candidate carries the same IMDB id as the query */
    EXTERNAL_ID,
    /** Normalized titles are identical and years are compatible */
    EXACT_TITLE,
    /** Titles clear the similarity threshold and years are compatible */
    FUZZY_TITLE,
    /** Not yet evaluated */
    UNRANKED
}
