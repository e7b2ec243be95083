package com.williamcallahan.cinema_lookup.service.web;

final class SiteQueries {

    private SiteQueries() {
    }

    /** {@code site:cinema.nl/db "title" year} */
    static String siteQuery(String title, Integer year) {
        String query = "site:cinema.nl/db \"" + title.replace("\"", "") + "\"";
        return year != null ? query + " " + year : query;
    }
}
