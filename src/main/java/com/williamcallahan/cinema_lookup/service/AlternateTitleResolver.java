/**
 * Resolves alternate titles and IMDB ids through the TMDB API
 *
 * @author William Callahan
 *
 * Features:
 * - IMDB id to TMDB id through /find, then original and alternative titles
 * - Original title first, then preferred countries (FR, NL, BE, DE), then everything else
 * - Title + year search to discover an IMDB id when the query has none
 * - Results held in an in-memory Caffeine cache
 * - Disabled (always empty) when no API key is configured
 */
package com.williamcallahan.cinema_lookup.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.util.ExternalApiLogger;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class AlternateTitleResolver {

    private static final String API_NAME = "TMDB";

    private final RateLimitedHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Cache<String, List<String>> alternateTitleCache;
    private final AppConfigurationProperties.Alternate config;

    public AlternateTitleResolver(RateLimitedHttpClient httpClient,
                                  ObjectMapper objectMapper,
                                  Cache<String, List<String>> alternateTitleCache,
                                  AppConfigurationProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.alternateTitleCache = alternateTitleCache;
        this.config = properties.getAlternate();
    }

    public boolean isConfigured() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Titles the same work is known under, most useful first
     *
     * @param externalId IMDB id
     * @param mediaType film or series
     * @return de-duplicated titles; empty when unconfigured, unknown to TMDB or on failure
     * @throws LookupStageException when TMDB could not be reached
     */
    public List<String> alternateTitles(String externalId, MediaType mediaType) {
        String imdbId = TextUtils.normalizeImdbId(externalId);
        if (imdbId == null || !isConfigured()) {
            return List.of();
        }
        MediaType type = mediaType != null ? mediaType : MediaType.FILM;
        String cacheKey = type.getValue() + ":" + imdbId;
        List<String> cached = alternateTitleCache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Alternate titles for {} served from memory", cacheKey);
            return cached;
        }

        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "alternateTitles", imdbId);
        Optional<String> tmdbId = findTmdbId(imdbId, type);
        if (tmdbId.isEmpty()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "alternateTitles", imdbId, 0);
            return List.of();
        }

        String segment = segment(type);
        Optional<JsonNode> details = getJson(segment + "/" + tmdbId.get(), Map.of());
        Optional<JsonNode> alternatives = getJson(segment + "/" + tmdbId.get() + "/alternative_titles", Map.of());

        String originalTitle = details
            .map(node -> node.path(type == MediaType.SERIES ? "original_name" : "original_title").asText(null))
            .orElse(null);
        List<String> titles = orderTitles(originalTitle,
            alternatives.map(node -> node.path(type == MediaType.SERIES ? "results" : "titles")).orElse(null));

        if (!titles.isEmpty()) {
            alternateTitleCache.put(cacheKey, titles);
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "alternateTitles", imdbId, titles.size());
        return titles;
    }

    /**
     * Discovers the IMDB id of a work from its title
     *
     * @param title title to search for
     * @param year release year, or null; an exact year hit is preferred over the first result
     * @param mediaType film or series
     * @return IMDB id, or empty when unconfigured or not found
     */
    public Optional<String> findExternalId(String title, Integer year, MediaType mediaType) {
        if (!isConfigured() || title == null || title.isBlank()) {
            return Optional.empty();
        }
        MediaType type = mediaType != null ? mediaType : MediaType.FILM;
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", title);
        if (year != null) {
            params.put(type == MediaType.SERIES ? "first_air_date_year" : "year", String.valueOf(year));
        }

        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "findExternalId", title);
        Optional<JsonNode> search = getJson("search/" + segment(type), params);
        JsonNode results = search.map(node -> node.path("results")).orElse(null);
        if (results == null || !results.isArray() || results.isEmpty()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "findExternalId", title, 0);
            return Optional.empty();
        }

        JsonNode chosen = results.get(0);
        if (year != null) {
            String dateField = type == MediaType.SERIES ? "first_air_date" : "release_date";
            for (JsonNode result : results) {
                String date = result.path(dateField).asText("");
                if (date.startsWith(String.valueOf(year))) {
                    chosen = result;
                    break;
                }
            }
        }

        String tmdbId = chosen.path("id").asText(null);
        if (tmdbId == null) {
            return Optional.empty();
        }
        Optional<String> imdbId = getJson(segment(type) + "/" + tmdbId + "/external_ids", Map.of())
            .map(node -> TextUtils.normalizeImdbId(node.path("imdb_id").asText(null)));
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "findExternalId", title, imdbId.isPresent() ? 1 : 0);
        imdbId.ifPresent(id -> log.info("Discovered IMDB id {} for '{}' ({})", id, title, year));
        return imdbId;
    }

    private Optional<String> findTmdbId(String imdbId, MediaType type) {
        return getJson("find/" + imdbId, Map.of("external_source", "imdb_id"))
            .map(node -> node.path(type == MediaType.SERIES ? "tv_results" : "movie_results"))
            .filter(results -> results.isArray() && results.size() > 0)
            .map(results -> results.get(0).path("id").asText(null));
    }

    List<String> orderTitles(String originalTitle, JsonNode alternatives) {
        List<String> preferred = new ArrayList<>();
        List<String> rest = new ArrayList<>();
        Map<String, List<String>> byCountry = new LinkedHashMap<>();
        if (alternatives != null) {
            for (JsonNode alternative : alternatives) {
                String title = alternative.path("title").asText(null);
                if (title == null || title.isBlank()) {
                    continue;
                }
                String country = alternative.path("iso_3166_1").asText("").toUpperCase(Locale.ROOT);
                if (config.getPreferredCountries().contains(country)) {
                    byCountry.computeIfAbsent(country, key -> new ArrayList<>()).add(title);
                } else {
                    rest.add(title);
                }
            }
        }
        for (String country : config.getPreferredCountries()) {
            preferred.addAll(byCountry.getOrDefault(country, List.of()));
        }

        Map<String, String> ordered = new LinkedHashMap<>();
        if (originalTitle != null && !originalTitle.isBlank()) {
            ordered.putIfAbsent(originalTitle.toLowerCase(Locale.ROOT), originalTitle);
        }
        preferred.forEach(title -> ordered.putIfAbsent(title.toLowerCase(Locale.ROOT), title));
        rest.forEach(title -> ordered.putIfAbsent(title.toLowerCase(Locale.ROOT), title));
        return List.copyOf(ordered.values());
    }

    private Optional<JsonNode> getJson(String path, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl() + "/" + path)
            .queryParam("api_key", config.getApiKey());
        params.forEach(builder::queryParam);
        String url = builder.encode().build().toUriString();

        HttpResult response = httpClient.get(url);
        if (!response.isSuccess()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, path, "", "HTTP " + response.status());
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new LookupStageException("Malformed TMDB response for " + path, e);
        }
    }

    private static String segment(MediaType type) {
        return type == MediaType.SERIES ? "tv" : "movie";
    }
}
