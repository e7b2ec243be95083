package com.williamcallahan.cinema_lookup.credentials;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds credentials with a key pattern and a secret pattern, each capturing the value in group 1
 */
public class RegexCredentialExtractor implements CredentialExtractor {

    private static final Pattern PLAUSIBLE_VALUE = Pattern.compile("^[A-Za-z0-9_\\-]{6,64}$");

    private final String name;
    private final Pattern keyPattern;
    private final Pattern secretPattern;

    public RegexCredentialExtractor(String name, Pattern keyPattern, Pattern secretPattern) {
        this.name = name;
        this.keyPattern = keyPattern;
        this.secretPattern = secretPattern;
    }

    /**
     * Extractors for the vprogids.nl frontend, most specific first:
     * named vpronl variables, JSON properties, JS assignments, then bare short key/secret literals
     */
    public static List<CredentialExtractor> defaults() {
        return List.of(
            new RegexCredentialExtractor("vpronl-variables",
                Pattern.compile("vpronlApiKey\\s*[=:]\\s*[\"']([^\"']+)[\"']"),
                Pattern.compile("vpronlSecret\\s*[=:]\\s*[\"']([^\"']+)[\"']")),
            new RegexCredentialExtractor("json-properties",
                Pattern.compile("\"apiKey\"\\s*:\\s*\"([^\"]+)\""),
                Pattern.compile("\"(?:apiSecret|secret)\"\\s*:\\s*\"([^\"]+)\"")),
            new RegexCredentialExtractor("js-assignments",
                Pattern.compile("apiKey\\s*[=:]\\s*[\"']([^\"']+)[\"']"),
                Pattern.compile("(?:apiSecret|secret)\\s*[=:]\\s*[\"']([^\"']+)[\"']")),
            new RegexCredentialExtractor("short-literals",
                Pattern.compile("\\bkey\\s*:\\s*[\"']([a-z0-9]{8,12})[\"']"),
                Pattern.compile("\\bsecret\\s*:\\s*[\"']([a-z0-9]{8,12})[\"']"))
        );
    }

    @Override
    public Optional<ExtractedCredentials> tryExtract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String key = firstPlausible(keyPattern, text);
        String secret = firstPlausible(secretPattern, text);
        if (key == null && secret == null) {
            return Optional.empty();
        }
        return Optional.of(new ExtractedCredentials(key, secret));
    }

    private static String firstPlausible(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1).trim();
            if (PLAUSIBLE_VALUE.matcher(value).matches()) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "RegexCredentialExtractor[" + name + "]";
    }
}
