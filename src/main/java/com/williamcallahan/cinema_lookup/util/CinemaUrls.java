package com.williamcallahan.cinema_lookup.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes and converts cinema.nl and legacy vprogids.nl page URLs.
 *
 * vprogids.nl: https://www.vprogids.nl/cinema/films/film~16092390~the-penguin-lessons~.html
 * cinema.nl:   https://www.cinema.nl/db/16092390-the-penguin-lessons
 */
public final class CinemaUrls {

    public static final String CINEMA_BASE_URL = "https://www.cinema.nl";

    private static final Pattern LEGACY_PAGE = Pattern.compile("(?:film|serie)~(\\d+)~([^~]+)~");
    private static final Pattern LEGACY_ID = Pattern.compile("(?:film|serie)~(\\d+)~");
    private static final Pattern CINEMA_PAGE = Pattern.compile("^https?://(?:www\\.)?cinema\\.nl/db/(\\d+)-[^/?#]+");

    private CinemaUrls() {
    }

    public static boolean isCinemaPage(String url) {
        return url != null && CINEMA_PAGE.matcher(url).find();
    }

    public static boolean isLegacyPage(String url) {
        return url != null && url.contains("vprogids.nl") && LEGACY_PAGE.matcher(url).find();
    }

    /**
     * @return the cinema.nl detail page for a cinema.nl or vprogids.nl URL, empty for anything else
     */
    public static Optional<String> toCinemaPage(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        Matcher cinema = CINEMA_PAGE.matcher(url);
        if (cinema.find()) {
            return Optional.of(cinema.group());
        }
        if (url.contains("vprogids.nl")) {
            Matcher legacy = LEGACY_PAGE.matcher(url);
            if (legacy.find()) {
                return Optional.of(CINEMA_BASE_URL + "/db/" + legacy.group(1) + "-" + legacy.group(2));
            }
        }
        return Optional.empty();
    }

    /**
     * @return numeric internal id from either URL style, or null
     */
    public static String internalId(String url) {
        if (url == null) {
            return null;
        }
        Matcher cinema = CINEMA_PAGE.matcher(url);
        if (cinema.find()) {
            return cinema.group(1);
        }
        Matcher legacy = LEGACY_ID.matcher(url);
        return legacy.find() ? legacy.group(1) : null;
    }
}
