package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.model.MediaType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDuckGo HTML endpoint. Result links are wrapped in a redirect carrying the target in {@code uddg}.
 */
@Order(1)
@Component
public class DuckDuckGoSearchEngine implements SearchEngine {

    private static final String SEARCH_URL = "https://html.duckduckgo.com/html/";

    @Override
    public String name() {
        return "duckduckgo";
    }

    @Override
    public String searchUrl(String title, Integer year, MediaType mediaType) {
        return UriComponentsBuilder.fromUriString(SEARCH_URL)
            .queryParam("q", "{q}")
            .encode()
            .buildAndExpand(SiteQueries.siteQuery(title, year))
            .toUriString();
    }

    @Override
    public List<String> resultUrls(Document results) {
        List<String> urls = new ArrayList<>();
        for (Element link : results.select("a[href]")) {
            String href = link.attr("href");
            if (href.contains("uddg=")) {
                String target = uddgTarget(href);
                if (target != null) {
                    urls.add(target);
                }
            } else if (href.startsWith("http")) {
                urls.add(href);
            }
        }
        return urls;
    }

    private static String uddgTarget(String href) {
        String absolute = href.startsWith("//") ? "https:" + href : href;
        if (absolute.startsWith("/")) {
            absolute = "https://duckduckgo.com" + absolute;
        }
        try {
            UriComponents components = UriComponentsBuilder.fromUriString(absolute).build();
            String encoded = components.getQueryParams().getFirst("uddg");
            return encoded != null ? URLDecoder.decode(encoded, StandardCharsets.UTF_8) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
