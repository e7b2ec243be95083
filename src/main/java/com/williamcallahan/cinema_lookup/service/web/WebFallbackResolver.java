/**
 * Last-resort resolver: web search for cinema.nl detail pages, then page scrape
 *
 * @author William Callahan
 *
 * Features:
 * - Engines tried in order (DuckDuckGo, Startpage, cinema.nl site search)
 * - Bot challenge pages abandon that engine for the current lookup only
 * - Result links narrowed to detail pages, legacy vprogids.nl links converted
 * - First scraped page with a valid description that passes matching wins
 */
package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.BotProtectionDetectedException;
import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import com.williamcallahan.cinema_lookup.service.CandidateMatcher;
import com.williamcallahan.cinema_lookup.util.CinemaUrls;
import com.williamcallahan.cinema_lookup.util.ExternalApiLogger;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
public class WebFallbackResolver {

    private final List<SearchEngine> engines;
    private final RateLimitedHttpClient httpClient;
    private final BotProtectionDetector botProtectionDetector;
    private final CinemaPageScraper pageScraper;
    private final CandidateMatcher candidateMatcher;
    private final MetricsService metricsService;
    private final int maxResultsPerEngine;

    public WebFallbackResolver(List<SearchEngine> engines,
                               RateLimitedHttpClient httpClient,
                               BotProtectionDetector botProtectionDetector,
                               CinemaPageScraper pageScraper,
                               CandidateMatcher candidateMatcher,
                               MetricsService metricsService,
                               AppConfigurationProperties properties) {
        this.engines = List.copyOf(engines);
        this.httpClient = httpClient;
        this.botProtectionDetector = botProtectionDetector;
        this.pageScraper = pageScraper;
        this.candidateMatcher = candidateMatcher;
        this.metricsService = metricsService;
        this.maxResultsPerEngine = properties.getWeb().getMaxResultsPerEngine();
    }

    public Optional<Candidate> searchWeb(String title, Integer year, MediaType mediaType) {
        return searchWeb(title, year, mediaType, null);
    }

    /**
     * Searches each engine in turn and scrapes its detail page hits
     *
     * @param externalId IMDB id of the query; when present only id or exact-title matches are accepted
     * @return the first accepted page; empty when every engine is exhausted
     */
    public Optional<Candidate> searchWeb(String title, Integer year, MediaType mediaType, String externalId) {
        Set<String> scraped = new HashSet<>();
        for (SearchEngine engine : engines) {
            List<String> pages;
            try {
                pages = detailPages(engine, title, year, mediaType);
            } catch (BotProtectionDetectedException e) {
                metricsService.incrementBotProtectionDetection(engine.name());
                ExternalApiLogger.logBotProtection(log, engine.name(), title, e.getSignature());
                continue;
            } catch (LookupStageException e) {
                ExternalApiLogger.logApiCallFailure(log, engine.name(), "search", title, e.getMessage());
                continue;
            }
            ExternalApiLogger.logApiCallSuccess(log, engine.name(), "search", title, pages.size());

            for (String page : pages) {
                if (!scraped.add(page)) {
                    continue;
                }
                Optional<Candidate> accepted = scrape(page)
                    .filter(candidate -> TextUtils.isValidDescription(candidate.getDescription()))
                    .map(candidate -> candidate.getMediaType() == null ? candidate.withMediaType(mediaType) : candidate)
                    .flatMap(candidate -> candidateMatcher.selectBest(title, year, externalId, List.of(candidate), externalId == null));
                if (accepted.isPresent()) {
                    log.info("Web fallback via {} found '{}' at {}", engine.name(), accepted.get().getTitle(), page);
                    return accepted;
                }
            }
        }
        log.info("Web fallback exhausted all {} engines for '{}'", engines.size(), title);
        return Optional.empty();
    }

    List<String> detailPages(SearchEngine engine, String title, Integer year, MediaType mediaType) {
        String url = engine.searchUrl(title, year, mediaType);
        ExternalApiLogger.logApiCallAttempt(log, engine.name(), "search", title);
        HttpResult response = httpClient.get(url, CinemaPageScraper.HTML_OPTIONS);
        Document document = Jsoup.parse(response.body(), url);

        Optional<String> challenge = botProtectionDetector.detect(document);
        if (challenge.isPresent()) {
            throw new BotProtectionDetectedException(engine.name(), challenge.get());
        }
        if (!response.isSuccess()) {
            throw new LookupStageException(engine.name() + " returned HTTP " + response.status());
        }
        return engine.resultUrls(document).stream()
            .map(CinemaUrls::toCinemaPage)
            .flatMap(Optional::stream)
            .distinct()
            .limit(maxResultsPerEngine)
            .collect(Collectors.toList());
    }

    private Optional<Candidate> scrape(String page) {
        try {
            return pageScraper.scrape(page);
        } catch (LookupStageException e) {
            ExternalApiLogger.logApiCallFailure(log, "CINEMA.NL", "scrape", page, e.getMessage());
            return Optional.empty();
        }
    }
}
