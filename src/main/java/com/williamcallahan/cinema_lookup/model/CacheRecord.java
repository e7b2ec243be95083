package com.williamcallahan.cinema_lookup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Persisted outcome of one lookup, found or not found.
 * Serialized as one JSON file per lookup key by the disk cache.
 *
 * A not_found record never carries a description; a found record always carries a non-blank one.
 *
 * @param lookupKey deterministic key derived from the query
 * @param title title of the matched work (query title for not_found)
 * @param year release year, when known
 * @param description synopsis; null for not_found
 * @param contentRating Kijkwijzer age rating (AL, 6, 9, 12, 14, 16, 18)
 * @param director director name(s)
 * @param genres genre display names
 * @param sourceUrl page the description came from
 * @param externalId IMDB id of the matched work
 * @param internalId cinema.nl / vprogids internal id
 * @param mediaType film or series
 * @param status found or not_found
 * @param lookupMethod stage that produced the match; null for not_found
 * @param discoveredExternalId IMDB id discovered through TMDB when the query had none
 * @param fetchedAt when the record was produced; TTL is measured from here
 * @param lastAccessedAt when the record was written; cache hits leave it unchanged and refresh the
 *                       file mtime instead, which is what LRU eviction orders by
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheRecord(
    @JsonProperty("lookup_key")
    String lookupKey,

    @JsonProperty("title")
    String title,

    @JsonProperty("year")
    Integer year,

    @JsonProperty("description")
    String description,

    @JsonProperty("content_rating")
    String contentRating,

    @JsonProperty("director")
    String director,

    @JsonProperty("genres")
    List<String> genres,

    @JsonProperty("source_url")
    String sourceUrl,

    @JsonProperty("external_id")
    String externalId,

    @JsonProperty("internal_id")
    String internalId,

    @JsonProperty("media_type")
    MediaType mediaType,

    @JsonProperty("status")
    CacheStatus status,

    @JsonProperty("lookup_method")
    LookupMethod lookupMethod,

    @JsonProperty("discovered_external_id")
    String discoveredExternalId,

    @JsonProperty("fetched_at")
    Instant fetchedAt,

    @JsonProperty("last_accessed_at")
    Instant lastAccessedAt
) {

    public CacheRecord {
        genres = genres == null ? List.of() : List.copyOf(genres);
    }

    /**
     * Promotes an accepted candidate into a found record
     */
    public static CacheRecord found(LookupQuery query, Candidate candidate, LookupMethod method,
                                    String discoveredExternalId, Instant now) {
        return new CacheRecord(
            query.lookupKey(),
            candidate.getTitle() != null ? candidate.getTitle() : query.title(),
            candidate.getYear() != null ? candidate.getYear() : query.year(),
            candidate.getDescription(),
            candidate.getContentRating(),
            candidate.getDirector(),
            candidate.getGenres(),
            candidate.getSourceUrl(),
            candidate.getExternalId() != null ? candidate.getExternalId() : query.externalId(),
            candidate.getInternalId(),
            candidate.getMediaType() != null ? candidate.getMediaType() : query.mediaType(),
            CacheStatus.FOUND,
            method,
            discoveredExternalId,
            now,
            now);
    }

    /**
     * Negative result for a query no stage could answer
     */
    public static CacheRecord notFound(LookupQuery query, String discoveredExternalId, Instant now) {
        return new CacheRecord(
            query.lookupKey(),
            query.title(),
            query.year(),
            null,
            null,
            null,
            List.of(),
            null,
            query.externalId(),
            null,
            query.mediaType(),
            CacheStatus.NOT_FOUND,
            null,
            discoveredExternalId,
            now,
            now);
    }

    @JsonIgnore
    public boolean isFound() {
        return status == CacheStatus.FOUND;
    }

    /**
     * Checks the invariants a record read back from disk must satisfy
     *
     * @return true when status and timestamps are present and the description agrees with the status
     */
    @JsonIgnore
    public boolean isStructurallyValid() {
        if (lookupKey == null || status == null || fetchedAt == null) {
            return false;
        }
        boolean hasDescription = description != null && !description.isBlank();
        return status == CacheStatus.FOUND ? hasDescription : description == null;
    }
}
