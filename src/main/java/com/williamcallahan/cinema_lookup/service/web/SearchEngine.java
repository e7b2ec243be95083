package com.williamcallahan.cinema_lookup.service.web;

import com.williamcallahan.cinema_lookup.model.MediaType;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * A web search engine the fallback resolver can ask for cinema.nl detail pages
 */
public interface SearchEngine {

    /** Short name used in logs and metrics */
    String name();

    /**
     * @return fully encoded search URL for the title
     */
    String searchUrl(String title, Integer year, MediaType mediaType);

    /**
     * Pulls result links out of a search results page. Links may point anywhere; the resolver
     * keeps only detail pages.
     */
    List<String> resultUrls(Document results);
}
