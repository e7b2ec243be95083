/**
 * Unconfirmed match proposal produced by one of the backends
 *
 * @author William Callahan
 *
 * Features:
 * - Carries everything needed to promote it into a CacheRecord
 * - Immutable; matching produces copies with the confidence filled in
 * - Never persisted directly
 */
package com.williamcallahan.cinema_lookup.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

@Value
@With
@Builder(toBuilder = true)
public class Candidate {
    String title;
    Integer year;
    @Builder.Default
    MatchConfidence confidence = MatchConfidence.UNRANKED;
    String description;
    String contentRating;
    String director;
    @Builder.Default
    List<String> genres = List.of();
    String sourceUrl;
    String externalId;
    String internalId;
    MediaType mediaType;
}
