/**
 * Decides which, if any, backend candidate answers a lookup
 *
 * @author William Callahan
 *
 * Features:
 * - Matching IMDB ids accept outright; conflicting ids reject outright
 * - Exact normalized title with a compatible year accepts, exact year first
 * - Fuzzy fallback ranks by title similarity, then year closeness
 * - Logs every rejected near-miss with the reason
 */
package com.williamcallahan.cinema_lookup.service;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MatchConfidence;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Slf4j
@Component
public class CandidateMatcher {

    private final double similarityThreshold;
    private final int yearTolerance;

    @Autowired
    public CandidateMatcher(AppConfigurationProperties properties) {
        this(properties.getMatching().getSimilarityThreshold(), properties.getMatching().getYearTolerance());
    }

    public CandidateMatcher(double similarityThreshold, int yearTolerance) {
        this.similarityThreshold = similarityThreshold;
        this.yearTolerance = yearTolerance;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    /**
     * Picks the accepted candidate, if any
     *
     * @param targetTitle title being searched for
     * @param targetYear release year, or null
     * @param targetExternalId IMDB id of the query, or null
     * @param candidates candidates in backend order
     * @param allowFuzzy false restricts acceptance to id and exact-title matches
     * @return the accepted candidate with its confidence set
     */
    public Optional<Candidate> selectBest(String targetTitle, Integer targetYear, String targetExternalId,
                                          List<Candidate> candidates, boolean allowFuzzy) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        String wantedId = TextUtils.normalizeImdbId(targetExternalId);

        List<Candidate> eligible = new ArrayList<>();
        for (Candidate candidate : candidates) {
            String candidateId = TextUtils.normalizeImdbId(candidate.getExternalId());
            if (wantedId != null && candidateId != null) {
                if (wantedId.equals(candidateId)) {
                    log.info("Accepted '{}' ({}) on IMDB id {}", candidate.getTitle(), candidate.getYear(), candidateId);
                    return Optional.of(candidate.withConfidence(MatchConfidence.EXTERNAL_ID));
                }
                logRejection(candidate, targetTitle, targetYear, "external id mismatch (" + candidateId + " != " + wantedId + ")");
                continue;
            }
            eligible.add(candidate);
        }

        if (targetYear != null) {
            for (Candidate candidate : eligible) {
                if (TextUtils.titlesMatch(candidate.getTitle(), targetTitle) && Objects.equals(candidate.getYear(), targetYear)) {
                    log.info("Accepted exact match '{}' ({})", candidate.getTitle(), candidate.getYear());
                    return Optional.of(candidate.withConfidence(MatchConfidence.EXACT_TITLE));
                }
            }
        }
        for (Candidate candidate : eligible) {
            if (TextUtils.titlesMatch(candidate.getTitle(), targetTitle)) {
                if (TextUtils.yearsCompatible(candidate.getYear(), targetYear, yearTolerance)) {
                    log.info("Accepted title match '{}' ({})", candidate.getTitle(), candidate.getYear());
                    return Optional.of(candidate.withConfidence(MatchConfidence.EXACT_TITLE));
                }
                logRejection(candidate, targetTitle, targetYear, "year mismatch");
            }
        }

        if (!allowFuzzy) {
            log.debug("No exact match for '{}' and fuzzy matching disabled (IMDB id supplied)", targetTitle);
            return Optional.empty();
        }

        List<Candidate> ranked = new ArrayList<>(eligible);
        ranked.sort(Comparator
            .comparingDouble((Candidate c) -> TextUtils.similarity(targetTitle, c.getTitle())).reversed()
            .thenComparingInt(c -> yearDistance(c.getYear(), targetYear)));

        if (ranked.isEmpty()) {
            return Optional.empty();
        }

        // Only the best-ranked candidate is eligible
        Candidate best = ranked.get(0);
        double similarity = TextUtils.similarity(targetTitle, best.getTitle());
        if (similarity < similarityThreshold) {
            logRejection(best, targetTitle, targetYear,
                String.format("title mismatch (similarity %.2f < %.2f)", similarity, similarityThreshold));
            return Optional.empty();
        }
        if (!TextUtils.yearsCompatible(best.getYear(), targetYear, yearTolerance)) {
            logRejection(best, targetTitle, targetYear, "year mismatch");
            return Optional.empty();
        }
        log.info("Accepted fuzzy match '{}' ({}) for '{}' with similarity {}",
            best.getTitle(), best.getYear(), targetTitle, String.format("%.2f", similarity));
        return Optional.of(best.withConfidence(MatchConfidence.FUZZY_TITLE));
    }

    private int yearDistance(Integer candidateYear, Integer targetYear) {
        if (candidateYear == null || targetYear == null) {
            return yearTolerance;
        }
        return Math.abs(candidateYear - targetYear);
    }

    private void logRejection(Candidate candidate, String targetTitle, Integer targetYear, String reason) {
        log.info("Rejected '{}' ({}) for '{}' ({}): {}",
            candidate.getTitle(), candidate.getYear(), targetTitle, targetYear, reason);
    }
}
