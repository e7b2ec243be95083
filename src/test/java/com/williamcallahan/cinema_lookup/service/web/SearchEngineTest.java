package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.model.MediaType;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SearchEngineTest {

    @Test
    void duckDuckGoBuildsSiteQuery() {
        String url = new DuckDuckGoSearchEngine().searchUrl("Der Untergang", 2004, MediaType.FILM);

        assertThat(url)
            .startsWith("https://html.duckduckgo.com/html/?q=")
            .contains("%22Der%20Untergang%22")
            .endsWith("2004");
    }

    @Test
    void plusSignInTitleIsEncodedNotTreatedAsSpace() {
        CinemaSiteSearchEngine cinema = new CinemaSiteSearchEngine(new AppConfigurationProperties());

        assertThat(new DuckDuckGoSearchEngine().searchUrl("Romeo + Juliet", 1996, MediaType.FILM))
            .contains("%22Romeo%20%2B%20Juliet%22");
        assertThat(new StartpageSearchEngine().searchUrl("Romeo + Juliet", 1996, MediaType.FILM))
            .contains("%22Romeo%20%2B%20Juliet%22")
            .endsWith("&cat=web&language=dutch");
        assertThat(cinema.searchUrl("Romeo + Juliet", 1996, MediaType.FILM))
            .isEqualTo("https://www.cinema.nl/zoeken?q=Romeo%20%2B%20Juliet%201996&model=cinema");
    }

    @Test
    void duckDuckGoUnwrapsRedirectLinks() {
        String html = "<html><body>"
            + "<a class='result__a' href='//duckduckgo.com/l/?uddg=https%3A%2F%2Fwww.cinema.nl%2Fdb%2F1234567-der-untergang&amp;rut=abc'>Der Untergang</a>"
            + "<a href='https://www.imdb.com/title/tt0363163/'>IMDb</a>"
            + "<a href='/settings'>Settings</a>"
            + "</body></html>";

        List<String> urls = new DuckDuckGoSearchEngine().resultUrls(Jsoup.parse(html, "https://html.duckduckgo.com/html/"));

        assertThat(urls).containsExactly(
            "https://www.cinema.nl/db/1234567-der-untergang",
            "https://www.imdb.com/title/tt0363163/");
    }

    @Test
    void startpageResolvesAbsoluteLinks() {
        String html = "<html><body>"
            + "<a class='w-gl__result-url' href='https://www.cinema.nl/db/1234567-der-untergang'>cinema.nl</a>"
            + "<a href='/sp/search?page=2'>Volgende</a>"
            + "</body></html>";

        List<String> urls = new StartpageSearchEngine().resultUrls(Jsoup.parse(html, "https://www.startpage.com/sp/search"));

        assertThat(urls).containsExactly(
            "https://www.cinema.nl/db/1234567-der-untergang",
            "https://www.startpage.com/sp/search?page=2");
    }

    @Test
    void cinemaSiteSearchReadsCardList() {
        CinemaSiteSearchEngine engine = new CinemaSiteSearchEngine(new AppConfigurationProperties());
        String html = "<html><body>"
            + "<nav><a href='/db/1-menu-link'>Menu</a></nav>"
            + "<ul class='CardList'>"
            + "<li><a href='/db/1234567-der-untergang'>Der Untergang</a></li>"
            + "<li><a href='/nieuws/123-artikel'>Artikel</a></li>"
            + "<li><a href='https://www.cinema.nl/db/7654321-downfall'>Downfall</a></li>"
            + "</ul></body></html>";

        List<String> urls = engine.resultUrls(Jsoup.parse(html, "https://www.cinema.nl/zoeken?q=untergang"));

        assertThat(urls).containsExactly(
            "https://www.cinema.nl/db/1234567-der-untergang",
            "https://www.cinema.nl/db/7654321-downfall");
        assertThat(engine.searchUrl("Der Untergang", null, MediaType.FILM))
            .isEqualTo("https://www.cinema.nl/zoeken?q=Der%20Untergang&model=cinema");
    }

    @Test
    void cinemaSiteSearchWithoutCardListIsEmpty() {
        CinemaSiteSearchEngine engine = new CinemaSiteSearchEngine(new AppConfigurationProperties());

        assertThat(engine.resultUrls(Jsoup.parse("<html><body><p>Geen resultaten</p></body></html>"))).isEmpty();
    }
}
