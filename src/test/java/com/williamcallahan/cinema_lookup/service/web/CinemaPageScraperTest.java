package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.exception.LookupStageException;
import com.williamcallahan.cinema_lookup.http.HttpResult;
import com.williamcallahan.cinema_lookup.http.RateLimitedHttpClient;
import com.williamcallahan.cinema_lookup.http.RequestOptions;
import com.williamcallahan.cinema_lookup.model.Candidate;
import com.williamcallahan.cinema_lookup.model.MediaType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CinemaPageScraperTest {

    private static final String URL = "https://www.cinema.nl/db/1234567-der-untergang";
    private static final String SYNOPSIS = "Berlijn, april 1945. In de bunker onder de Rijkskanselarij beleeft "
        + "Hitlers jonge secretaresse de laatste dagen van het Derde Rijk van dichtbij mee.";

    private static final String FILM_PAGE = "<html><head>"
        + "<meta name='description' content='Bekijk Der Untergang op cinema.nl'>"
        + "</head><body>"
        + "<h1>Der Untergang</h1>"
        + "<div class='meta'>Film • Drama, Oorlog • 2004 • 156 min</div>"
        + "<div class='kijkwijzer'>16</div>"
        + "<div class='credits'>Regie: Oliver Hirschbiegel</div>"
        + "<blockquote>" + SYNOPSIS + "</blockquote>"
        + "<a href='https://www.imdb.com/title/tt0363163/'>IMDb</a>"
        + "</body></html>";

    @Mock
    private RateLimitedHttpClient httpClient;

    private CinemaPageScraper scraper;

    @BeforeEach
    void setUp() {
        scraper = new CinemaPageScraper(httpClient);
    }

    @Test
    void parsesFilmPage() {
        Optional<Candidate> parsed = scraper.parse(URL, FILM_PAGE);

        assertThat(parsed).isPresent();
        Candidate candidate = parsed.get();
        assertThat(candidate.getTitle()).isEqualTo("Der Untergang");
        assertThat(candidate.getYear()).isEqualTo(2004);
        assertThat(candidate.getDescription()).isEqualTo(SYNOPSIS);
        assertThat(candidate.getContentRating()).isEqualTo("16");
        assertThat(candidate.getDirector()).isEqualTo("Oliver Hirschbiegel");
        assertThat(candidate.getGenres()).containsExactly("Drama", "Oorlog");
        assertThat(candidate.getExternalId()).isEqualTo("tt0363163");
        assertThat(candidate.getInternalId()).isEqualTo("1234567");
        assertThat(candidate.getMediaType()).isEqualTo(MediaType.FILM);
    }

    @Test
    void fallsBackToMetaDescription() {
        String html = "<html><head><meta property='og:description' content='" + SYNOPSIS + "'></head>"
            + "<body><h1>Heimat</h1><p>Serie • 1984</p><blockquote>Te kort.</blockquote></body></html>";

        Candidate candidate = scraper.parse("https://www.cinema.nl/db/42-heimat", html).orElseThrow();

        assertThat(candidate.getDescription()).isEqualTo(SYNOPSIS);
        assertThat(candidate.getMediaType()).isEqualTo(MediaType.SERIES);
        assertThat(candidate.getYear()).isEqualTo(1984);
    }

    @Test
    void loginPageYieldsNoDescription() {
        String html = "<html><body><h1>Inloggen</h1><blockquote>"
            + "Log in met uw gebruikersnaam en wachtwoord om deze pagina met alle filmrecensies te bekijken."
            + "</blockquote></body></html>";

        assertThat(scraper.parse(URL, html)).get().extracting(Candidate::getDescription).isNull();
    }

    @Test
    void pageWithoutTitleIsSkipped() {
        assertThat(scraper.parse(URL, "<html><body><p>" + SYNOPSIS + "</p></body></html>")).isEmpty();
    }

    @Test
    void scrapeFetchesAndParses() {
        when(httpClient.get(eq(URL), any(RequestOptions.class))).thenReturn(new HttpResult(200, FILM_PAGE, null));

        assertThat(scraper.scrape(URL)).get().extracting(Candidate::getTitle).isEqualTo("Der Untergang");
    }

    @Test
    void missingPageIsEmpty() {
        when(httpClient.get(eq(URL), any(RequestOptions.class))).thenReturn(new HttpResult(404, "", null));

        assertThat(scraper.scrape(URL)).isEmpty();
    }

    @Test
    void serverErrorIsAStageFailure() {
        when(httpClient.get(eq(URL), any(RequestOptions.class))).thenReturn(new HttpResult(503, "", null));

        assertThatThrownBy(() -> scraper.scrape(URL)).isInstanceOf(LookupStageException.class);
    }
}
