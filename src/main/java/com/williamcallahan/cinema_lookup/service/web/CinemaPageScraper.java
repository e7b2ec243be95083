/**
 * Scrapes film and series details from cinema.nl detail pages
 *
 * @author William Callahan
 *
 * Features:
 * - Handles the /db/{id}-{slug} page format
 * - Description from the review blockquote, article paragraphs, intro blocks, then meta tags
 * - Year, Kijkwijzer rating, IMDB id, director, genres and media type from page metadata
 * - Page fetches are guarded by the "cinemaPages" circuit breaker
 */
package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.http.RequestOptions;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.util.CinemaUrls;
import com.williamcallahan.cinema_lookup.util.ExternalApiLogger;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class CinemaPageScraper {

    public static final String CIRCUIT_BREAKER = "cinemaPages";

    static final RequestOptions HTML_OPTIONS = RequestOptions.builder()
        .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
        .header(HttpHeaders.ACCEPT_LANGUAGE, "nl-NL,nl;q=0.9,en;q=0.8")
        .build();

    private static final int MIN_ARTICLE_PARAGRAPH_LENGTH = 100;
    private static final int MAX_GENRES = 5;

    private static final Pattern IMDB_LINK = Pattern.compile("https?://(?:www\\.)?imdb\\.com/title/(tt\\d{7,10})");
    private static final Pattern STRUCTURED_YEAR = Pattern.compile("(?:film|serie)\\s*[•·]\\s*(\\d{4})");
    private static final Pattern KIJKWIJZER_LABELLED = Pattern.compile("(?i)kijkwijzer\\W{0,20}(AL|6|9|12|14|16|18)\\b");
    private static final Pattern KIJKWIJZER_BARE = Pattern.compile("\\b(AL|6|9|12|14|16|18)\\+?(?:\\s|$)");
    private static final Pattern DIRECTOR_CREDIT =
        Pattern.compile("(?:[Rr]egie|[Rr]egisseur|[Dd]irector)[:\\s]+(\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+)+)");
    private static final Pattern DIRECTOR_TEXT =
        Pattern.compile("(?:[Rr]egie|[Rr]egisseur|[Dd]irector)[:\\s]+(\\p{Lu}\\p{Ll}+ \\p{Lu}\\p{Ll}+)");
    private static final Pattern GENRE_SEGMENT = Pattern.compile("[•·]\\s*([^•·]+?)\\s*[•·]");
    private static final Pattern FILM_MARKER = Pattern.compile("\\bfilm\\s*[•·]");
    private static final Pattern SERIES_MARKER = Pattern.compile("\\bserie\\s*[•·]");
    private static final List<Pattern> SERIES_HINTS = List.of(
        Pattern.compile("\\bserie\\b"),
        Pattern.compile("\\bseizoen\\s*\\d"),
        Pattern.compile("\\baflever"),
        Pattern.compile("\\bepisode\\s*\\d"),
        Pattern.compile("\\bseason\\s*\\d")
    );

    private static final List<String> KNOWN_GENRES = List.of(
        "actie", "avontuur", "animatie", "biografie", "comedy", "misdaad",
        "documentaire", "drama", "familie", "fantasy", "film-noir",
        "geschiedenis", "horror", "muziek", "musical", "mysterie",
        "romantiek", "sciencefiction", "sci-fi", "sport", "thriller",
        "oorlog", "western", "komedie", "romantisch", "actiefilm",
        "dramafilm", "horrorfilm", "tragikomedie"
    );

    private final RateLimitedHttpClient httpClient;

    public CinemaPageScraper(RateLimitedHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Fetches and parses a detail page
     *
     * @param url cinema.nl detail page URL
     * @return the page as a candidate; empty when the page is missing or has no title
     * @throws LookupStageException when the page could not be fetched (counted by the circuit breaker)
     */
    @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "scrapeFallback")
    public Optional<Candidate> scrape(String url) {
        HttpResult response = httpClient.get(url, HTML_OPTIONS);
        if (response.status() >= 500) {
            throw new LookupStageException("cinema.nl returned HTTP " + response.status() + " for " + url);
        }
        if (!response.isSuccess()) {
            log.debug("Page {} returned HTTP {}", url, response.status());
            return Optional.empty();
        }
        return parse(url, response.body());
    }

    private Optional<Candidate> scrapeFallback(String url, Throwable throwable) {
        if (throwable instanceof CallNotPermittedException) {
            ExternalApiLogger.logCircuitBreakerBlocked(log, "CINEMA.NL", url);
        } else {
            ExternalApiLogger.logApiCallFailure(log, "CINEMA.NL", "scrape", url, throwable.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Parses an already fetched detail page
     *
     * @param url page URL, used for relative links and the internal id
     * @param html page source
     * @return the page as a candidate; the description is null when none passed validation
     */
    public Optional<Candidate> parse(String url, String html) {
        Document document = Jsoup.parse(html, url);
        String pageText = document.text();

        Element heading = document.selectFirst("h1");
        String title = heading != null ? heading.text().trim() : "";
        if (title.isEmpty()) {
            log.debug("No title found on {}", url);
            return Optional.empty();
        }

        return Optional.of(Candidate.builder()
            .title(title)
            .year(extractYear(document, pageText))
            .description(extractDescription(document))
            .contentRating(extractContentRating(document, pageText))
            .director(extractDirector(document, pageText))
            .genres(extractGenres(document, pageText))
            .sourceUrl(url)
            .externalId(extractImdbId(document, html))
            .internalId(CinemaUrls.internalId(url))
            .mediaType(detectMediaType(pageText))
            .build());
    }

    private String extractDescription(Document document) {
        Element blockquote = document.selectFirst("blockquote");
        if (blockquote != null) {
            String text = validDescription(blockquote.text());
            if (text != null) {
                return text;
            }
        }

        Element article = document.selectFirst("article");
        if (article != null) {
            for (Element paragraph : article.select("p")) {
                String raw = paragraph.text();
                if (raw.length() > MIN_ARTICLE_PARAGRAPH_LENGTH) {
                    String text = validDescription(raw);
                    if (text != null) {
                        return text;
                    }
                }
            }
        }

        Element intro = document.selectFirst("[class~=(?i)intro|description|body|review]");
        if (intro != null) {
            String text = validDescription(intro.text());
            if (text != null) {
                return text;
            }
        }

        Element metaDescription = document.selectFirst("meta[name=description]");
        if (metaDescription != null) {
            String text = validDescription(metaDescription.attr("content"));
            if (text != null) {
                log.debug("Using meta description");
                return text;
            }
        }

        Element ogDescription = document.selectFirst("meta[property=og:description]");
        if (ogDescription != null) {
            String text = validDescription(ogDescription.attr("content"));
            if (text != null) {
                log.debug("Using og:description");
                return text;
            }
        }
        return null;
    }

    private static String validDescription(String raw) {
        String sanitized = TextUtils.sanitizeDescription(raw);
        return TextUtils.isValidDescription(sanitized) ? sanitized : null;
    }

    private Integer extractYear(Document document, String pageText) {
        Matcher structured = STRUCTURED_YEAR.matcher(pageText.toLowerCase(Locale.ROOT));
        if (structured.find()) {
            return Integer.parseInt(structured.group(1));
        }
        Element meta = document.selectFirst("[class~=(?i)meta|credits|info]");
        if (meta != null) {
            Integer year = TextUtils.extractYear(meta.text());
            if (year != null) {
                return year;
            }
        }
        return TextUtils.extractYear(pageText);
    }

    private String extractContentRating(Document document, String pageText) {
        for (Element element : document.select("[class~=(?i)kijkwijzer|agerating|age-rating]")) {
            Matcher matcher = KIJKWIJZER_BARE.matcher(element.text() + " ");
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        Matcher labelled = KIJKWIJZER_LABELLED.matcher(pageText);
        if (labelled.find()) {
            return labelled.group(1).toUpperCase(Locale.ROOT);
        }
        Element meta = document.selectFirst("[class~=(?i)meta|credits|info]");
        if (meta != null) {
            Matcher bare = KIJKWIJZER_BARE.matcher(meta.text() + " ");
            if (bare.find()) {
                return bare.group(1);
            }
        }
        return null;
    }

    private String extractImdbId(Document document, String html) {
        for (Element link : document.select("a[href]")) {
            Matcher matcher = IMDB_LINK.matcher(link.attr("href"));
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        Matcher matcher = IMDB_LINK.matcher(html);
        return matcher.find() ? matcher.group(1) : null;
    }

    private MediaType detectMediaType(String pageText) {
        String lower = pageText.toLowerCase(Locale.ROOT);
        if (FILM_MARKER.matcher(lower).find()) {
            return MediaType.FILM;
        }
        if (SERIES_MARKER.matcher(lower).find()) {
            return MediaType.SERIES;
        }
        for (Pattern hint : SERIES_HINTS) {
            if (hint.matcher(lower).find()) {
                return MediaType.SERIES;
            }
        }
        return MediaType.FILM;
    }

    private String extractDirector(Document document, String pageText) {
        Element credits = document.selectFirst("[class~=(?i)credits|crew]");
        if (credits != null) {
            Matcher matcher = DIRECTOR_CREDIT.matcher(credits.text());
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        Matcher matcher = DIRECTOR_TEXT.matcher(pageText);
        return matcher.find() ? matcher.group(1) : null;
    }

    private List<String> extractGenres(Document document, String pageText) {
        Element meta = document.selectFirst("[class~=(?i)credits|meta|genre|info|details]");
        String searchText = (meta != null ? meta.text() : pageText).toLowerCase(Locale.ROOT);

        Set<String> genres = new LinkedHashSet<>();
        Matcher segment = GENRE_SEGMENT.matcher(searchText);
        if (segment.find()) {
            for (String part : segment.group(1).split(",")) {
                String genre = part.trim();
                if (KNOWN_GENRES.contains(genre)) {
                    genres.add(capitalize(genre));
                }
            }
        }
        if (genres.isEmpty()) {
            for (String genre : KNOWN_GENRES) {
                if (Pattern.compile("\\b" + Pattern.quote(genre) + "\\b").matcher(searchText).find()) {
                    genres.add(capitalize(genre));
                }
            }
        }
        List<String> result = new ArrayList<>(genres);
        return result.size() > MAX_GENRES ? List.copyOf(result.subList(0, MAX_GENRES)) : List.copyOf(result);
    }

    private static String capitalize(String genre) {
        return Character.toUpperCase(genre.charAt(0)) + genre.substring(1);
    }
}
