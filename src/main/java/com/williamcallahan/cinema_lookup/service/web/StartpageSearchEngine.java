package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.model.MediaType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Startpage web search, Dutch results
 */
@Order(2)
@Component
public class StartpageSearchEngine implements SearchEngine {

    private static final String SEARCH_URL = "https://www.startpage.com/sp/search";

    @Override
    public String name() {
        return "startpage";
    }

    @Override
    public String searchUrl(String title, Integer year, MediaType mediaType) {
        return UriComponentsBuilder.fromUriString(SEARCH_URL)
            .queryParam("query", "{query}")
            .queryParam("cat", "web")
            .queryParam("language", "dutch")
            .encode()
            .buildAndExpand(SiteQueries.siteQuery(title, year))
            .toUriString();
    }

    @Override
    public List<String> resultUrls(Document results) {
        List<String> urls = new ArrayList<>();
        for (Element link : results.select("a[href]")) {
            String href = link.absUrl("href");
            if (!href.isBlank()) {
                urls.add(href);
            }
        }
        return urls;
    }
}
