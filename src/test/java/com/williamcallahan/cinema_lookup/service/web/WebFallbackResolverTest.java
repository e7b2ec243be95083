package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.http.RequestOptions;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.monitoring.MetricsService;
import com.williamcallahan.cinema_lookup.service.CandidateMatcher;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebFallbackResolverTest {

    private static final String SYNOPSIS = "Berlijn, april 1945. In de bunker onder de Rijkskanselarij beleeft "
        + "Hitlers jonge secretaresse de laatste dagen van het Derde Rijk van dichtbij mee.";
    private static final String PAGE_A = "https://www.cinema.nl/db/1111111-untergang-the-musical";
    private static final String PAGE_B = "https://www.cinema.nl/db/2222222-der-untergang";
    private static final String RESULTS = "<html><body><p>results</p></body></html>";
    private static final String CHALLENGE = "<html><body><div class='g-recaptcha'></div></body></html>";

    @Mock
    private RateLimitedHttpClient httpClient;

    @Mock
    private CinemaPageScraper pageScraper;

    @Mock
    private MetricsService metricsService;

    /** Engine with a fixed result list, independent of the page it is handed */
    private static final class FixedEngine implements SearchEngine {
        private final String name;
        private final List<String> urls;

        FixedEngine(String name, List<String> urls) {
            this.name = name;
            this.urls = urls;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String searchUrl(String title, Integer year, MediaType mediaType) {
            return "https://search.example/" + name;
        }

        @Override
        public List<String> resultUrls(Document results) {
            return urls;
        }
    }

    private WebFallbackResolver resolver(SearchEngine... engines) {
        return new WebFallbackResolver(List.of(engines), httpClient, new BotProtectionDetector(), pageScraper,
            new CandidateMatcher(0.75, 2), metricsService, new AppConfigurationProperties());
    }

    private void searchPage(String engine, String html) {
        when(httpClient.get(eq("https://search.example/" + engine), any(RequestOptions.class)))
            .thenReturn(new HttpResult(200, html, null));
    }

    private static Candidate page(String title, Integer year, String description) {
        return Candidate.builder().title(title).year(year).description(description).mediaType(MediaType.FILM).build();
    }

    @Test
    void botChallengeSkipsToNextEngine() {
        searchPage("blocked", CHALLENGE);
        searchPage("open", RESULTS);
        when(pageScraper.scrape(PAGE_B)).thenReturn(Optional.of(page("Der Untergang", 2004, SYNOPSIS)));

        Optional<Candidate> result = resolver(
            new FixedEngine("blocked", List.of(PAGE_B)),
            new FixedEngine("open", List.of(PAGE_B))
        ).searchWeb("Der Untergang", 2004, MediaType.FILM);

        assertThat(result).get().extracting(Candidate::getTitle).isEqualTo("Der Untergang");
        verify(metricsService).incrementBotProtectionDetection("blocked");
        verify(pageScraper, times(1)).scrape(PAGE_B);
    }

    @Test
    void nonDetailLinksAreIgnoredAndLegacyLinksConverted() {
        searchPage("ddg", RESULTS);
        when(pageScraper.scrape(PAGE_B)).thenReturn(Optional.of(page("Der Untergang", 2004, SYNOPSIS)));

        Optional<Candidate> result = resolver(new FixedEngine("ddg", List.of(
            "https://www.imdb.com/title/tt0363163/",
            "https://www.vprogids.nl/cinema/films/film~2222222~der-untergang~.html"
        ))).searchWeb("Der Untergang", 2004, MediaType.FILM);

        assertThat(result).isPresent();
        verify(pageScraper).scrape(PAGE_B);
        verify(pageScraper, never()).scrape("https://www.imdb.com/title/tt0363163/");
    }

    @Test
    void rejectedPagesAreNotScrapedTwice() {
        searchPage("first", RESULTS);
        searchPage("second", RESULTS);
        when(pageScraper.scrape(PAGE_A)).thenReturn(Optional.of(page("Untergang: The Musical", 2019, SYNOPSIS)));
        when(pageScraper.scrape(PAGE_B)).thenReturn(Optional.of(page("Der Untergang", 2004, SYNOPSIS)));

        Optional<Candidate> result = resolver(
            new FixedEngine("first", List.of(PAGE_A)),
            new FixedEngine("second", List.of(PAGE_A, PAGE_B))
        ).searchWeb("Der Untergang", 2004, MediaType.FILM);

        assertThat(result).get().extracting(Candidate::getTitle).isEqualTo("Der Untergang");
        verify(pageScraper, times(1)).scrape(PAGE_A);
    }

    @Test
    void pagesWithoutValidDescriptionAreSkipped() {
        searchPage("ddg", RESULTS);
        when(pageScraper.scrape(PAGE_B)).thenReturn(Optional.of(page("Der Untergang", 2004, null)));

        assertThat(resolver(new FixedEngine("ddg", List.of(PAGE_B))).searchWeb("Der Untergang", 2004, MediaType.FILM))
            .isEmpty();
    }

    @Test
    void failingEngineIsSkipped() {
        when(httpClient.get(eq("https://search.example/down"), any(RequestOptions.class)))
            .thenReturn(new HttpResult(503, "", null));

        assertThat(resolver(new FixedEngine("down", List.of(PAGE_B))).searchWeb("Der Untergang", 2004, MediaType.FILM))
            .isEmpty();
        verify(pageScraper, never()).scrape(anyString());
    }
}
