package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.model.MediaType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * cinema.nl's own search, restricted to the film/series database.
 * Results are a card list linking /db/{id}-{slug} pages.
 */
@Order(3)
@Component
public class CinemaSiteSearchEngine implements SearchEngine {

    private final String baseUrl;

    public CinemaSiteSearchEngine(AppConfigurationProperties properties) {
        this.baseUrl = properties.getWeb().getCinemaBaseUrl();
    }

    @Override
    public String name() {
        return "cinema.nl";
    }

    @Override
    public String searchUrl(String title, Integer year, MediaType mediaType) {
        String query = year != null ? title + " " + year : title;
        return UriComponentsBuilder.fromUriString(baseUrl + "/zoeken")
            .queryParam("q", "{q}")
            .queryParam("model", "cinema")
            .encode()
            .buildAndExpand(query)
            .toUriString();
    }

    @Override
    public List<String> resultUrls(Document results) {
        List<String> urls = new ArrayList<>();
        Element cardList = results.selectFirst("ul.CardList");
        if (cardList == null) {
            cardList = results.selectFirst("ul[class~=CardList|card-list|results]");
        }
        if (cardList == null) {
            return urls;
        }
        for (Element link : cardList.select("li a[href^=/db/], li a[href*=cinema.nl/db/]")) {
            urls.add(link.absUrl("href"));
        }
        return urls;
    }
}
