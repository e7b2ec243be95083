/**
 * Client for the NPO POMS pages API, the primary source of synopses
 *
 * @author William Callahan
 *
 * Features:
 * - HMAC-signed searches restricted to the vprocinema profile
 * - Film/series filtering through the types facet
 * - Falls back to the cinema.nl page when the API paragraph is missing or unusable
 * - Acceptance delegated to CandidateMatcher (id, exact title, then fuzzy)
 */
package com.williamcallahan.cinema_lookup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.credentials.CredentialManager;
import com.williamcallahan.cinema_lookup.exception.AuthRejectedException;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.http.RequestOptions;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.service.web.CinemaPageScraper;
import com.williamcallahan.cinema_lookup.util.CinemaUrls;
import com.williamcallahan.cinema_lookup.util.ExternalApiLogger;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class PrimaryApiClient {

    private static final String API_NAME = "POMS";
    private static final String PAGES_PATH = "pages/";

    private final RateLimitedHttpClient httpClient;
    private final PomsRequestSigner requestSigner;
    private final CredentialManager credentialManager;
    private final CandidateMatcher candidateMatcher;
    private final CinemaPageScraper pageScraper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AppConfigurationProperties.Primary config;

    public PrimaryApiClient(RateLimitedHttpClient httpClient,
                            PomsRequestSigner requestSigner,
                            CredentialManager credentialManager,
                            CandidateMatcher candidateMatcher,
                            CinemaPageScraper pageScraper,
                            ObjectMapper objectMapper,
                            Clock clock,
                            AppConfigurationProperties properties) {
        this.httpClient = httpClient;
        this.requestSigner = requestSigner;
        this.credentialManager = credentialManager;
        this.candidateMatcher = candidateMatcher;
        this.pageScraper = pageScraper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getPrimary();
    }

    public Optional<Candidate> search(String title, Integer year, MediaType mediaType) {
        return search(title, year, mediaType, null);
    }

    /**
     * Searches POMS and picks the accepted result
     *
     * @param title title to search for
     * @param year release year, or null
     * @param mediaType film or series
     * @param externalId IMDB id of the query; disables fuzzy acceptance when present
     * @return accepted candidate with a valid description, or empty on a miss
     * @throws AuthRejectedException when POMS answers 401 or 403
     * @throws LookupStageException when the request could not be completed
     */
    public Optional<Candidate> search(String title, Integer year, MediaType mediaType, String externalId) {
        MediaType type = mediaType != null ? mediaType : MediaType.FILM;
        Map<String, String> params = new LinkedHashMap<>();
        params.put("profile", config.getProfile());
        params.put("max", String.valueOf(config.getMaxResults()));

        String url = config.getBaseUrl() + "/" + PAGES_PATH + "?" + params.entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("&"));

        RequestOptions options = RequestOptions.builder()
            .headers(requestSigner.headers(credentialManager.currentCredentials(), PAGES_PATH, params, clock.instant()))
            .jsonBody(requestBody(title, type))
            .idempotent(true)
            .build();

        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "search", title);
        HttpResult response = httpClient.post(url, options);
        if (response.status() == 401 || response.status() == 403) {
            throw new AuthRejectedException(response.status());
        }
        if (!response.isSuccess()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "search", title, "HTTP " + response.status());
            return Optional.empty();
        }

        List<Candidate> candidates = parseResponse(response.body(), type);
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "search", title, candidates.size());
        return candidateMatcher.selectBest(title, year, externalId, candidates, externalId == null);
    }

    private String requestBody(String title, MediaType mediaType) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("highlight", true);
        body.putObject("searches").put("text", title);
        body.putObject("facets").putObject("types").put("include", mediaType.getPomsType());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize POMS request body", e);
        }
    }

    private List<Candidate> parseResponse(String body, MediaType mediaType) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LookupStageException("Malformed POMS response: " + e.getOriginalMessage(), e);
        }
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            parseItem(item.path("result"), mediaType)
                .flatMap(this::withDescription)
                .ifPresent(candidates::add);
        }
        return candidates;
    }

    /**
     * Maps one POMS result to a candidate; the description is null when the API text is unusable
     *
     * @return empty for results of another media type or without a title
     */
    Optional<Candidate> parseItem(JsonNode result, MediaType mediaType) {
        if (!mediaType.getPomsType().equals(result.path("type").asText(null))) {
            return Optional.empty();
        }
        String title = result.path("title").asText(null);
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }

        Integer year = null;
        String director = null;
        String contentRating = null;
        for (JsonNode relation : result.path("relations")) {
            String value = relation.path("value").asText(null);
            if (value == null) {
                continue;
            }
            switch (relation.path("type").asText("")) {
                case "CINEMA_YEAR" -> year = TextUtils.extractYear(value);
                case "CINEMA_DIRECTOR" -> director = value;
                case "CINEMA_AGERATING" -> contentRating = value.startsWith("_") ? value.substring(1) : value;
                default -> {
                }
            }
        }

        List<String> genres = new ArrayList<>();
        for (JsonNode genre : result.path("genres")) {
            String name = genre.path("displayName").asText(null);
            if (name != null && !name.isBlank()) {
                genres.add(name);
            }
        }

        String description = null;
        JsonNode paragraphs = result.path("paragraphs");
        if (paragraphs.isArray() && paragraphs.size() > 0) {
            String sanitized = TextUtils.sanitizeDescription(paragraphs.get(0).path("body").asText(null));
            description = TextUtils.isValidDescription(sanitized) ? sanitized : null;
        }

        String url = result.path("url").asText(null);
        return Optional.of(Candidate.builder()
            .title(title)
            .year(year)
            .description(description)
            .contentRating(contentRating)
            .director(director)
            .genres(genres)
            .sourceUrl(url)
            .internalId(CinemaUrls.internalId(url))
            .mediaType(mediaType)
            .build());
    }

    private Optional<Candidate> withDescription(Candidate candidate) {
        if (candidate.getDescription() != null) {
            return Optional.of(candidate);
        }
        Optional<String> page = CinemaUrls.toCinemaPage(candidate.getSourceUrl());
        if (page.isEmpty()) {
            log.debug("Dropping '{}': no usable description and no cinema.nl page", candidate.getTitle());
            return Optional.empty();
        }
        try {
            return pageScraper.scrape(page.get())
                .filter(scraped -> scraped.getDescription() != null)
                .map(scraped -> candidate.toBuilder()
                    .description(scraped.getDescription())
                    .sourceUrl(page.get())
                    .externalId(scraped.getExternalId())
                    .contentRating(candidate.getContentRating() != null ? candidate.getContentRating() : scraped.getContentRating())
                    .director(candidate.getDirector() != null ? candidate.getDirector() : scraped.getDirector())
                    .build());
        } catch (LookupStageException e) {
            ExternalApiLogger.logApiCallFailure(log, "CINEMA.NL", "scrape", page.get(), e.getMessage());
            return Optional.empty();
        }
    }
}
