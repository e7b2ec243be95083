package com.williamcallahan.cinema_lookup.util;

import org.jsoup.parser.Parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility class for title normalization, matching and description cleanup.
 * Provides consistent text handling across every lookup stage.
 */
public class TextUtils {

    public static final int MIN_DESCRIPTION_LENGTH = 50;
    public static final int MIN_DESCRIPTION_WORDS = 10;
    public static final int MAX_SLUG_LENGTH = 50;

    private static final int MIN_FILM_YEAR = 1888;
    private static final int MAX_FILM_YEAR = 2100;

    private static final Pattern DASHES = Pattern.compile("[\\u2010-\\u2015\\u2212\\uFE58\\uFE63\\uFF0D]");
    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019\\u201A\\u201B\\u2032\\u00B4`]");
    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D\\u201E\\u201F\\u2033\\u00AB\\u00BB]");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9-]+");
    private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
    private static final Pattern NON_ASCII_ALNUM = Pattern.compile("[\\p{L}\\p{N}&&[^a-z0-9]]");

    private static final Pattern PARENTHESIZED_YEAR = Pattern.compile("\\((\\d{4})\\)");
    private static final Pattern BARE_YEAR = Pattern.compile("\\b(19\\d{2}|20\\d{2})\\b");

    private static final List<Pattern> IMDB_PATTERNS = List.of(
        Pattern.compile("imdb-(tt\\d{7,8})", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\{imdb-(tt\\d{7,8})\\}", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\[(tt\\d{7,8})\\]", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?<![a-z])(tt\\d{7,8})(?![0-9])", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern VALID_IMDB = Pattern.compile("^tt\\d{7,8}$");

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern LINE_BREAK_TAG = Pattern.compile("(?i)<br\\s*/?>|</p>");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{C}&&[^\\n\\t]]");

    // Dutch and English login/error page markers
    private static final List<String> INVALID_DESCRIPTION_MARKERS = List.of(
        "log in met",
        "inloggen",
        "gebruikersnaam en wachtwoord",
        "u moet ingelogd zijn",
        "toegang geweigerd",
        "geen toegang",
        "pagina niet gevonden",
        "sessie verlopen",
        "deze pagina is niet beschikbaar",
        "please log in",
        "sign in to",
        "login required",
        "access denied",
        "page not found",
        "session expired",
        "unauthorized",
        "403 forbidden",
        "401 unauthorized",
        "404 not found"
    );

    private TextUtils() {
        // Private constructor to prevent instantiation
    }

    /**
     * Reduces a title to its comparison form.
     * Applies NFKC, unifies dashes and quotes, lowercases, strips diacritics and punctuation,
     * and collapses whitespace.
     *
     * @param text raw title
     * @return comparison form, empty for null input
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = DASHES.matcher(result).replaceAll("-");
        result = SINGLE_QUOTES.matcher(result).replaceAll("'");
        result = DOUBLE_QUOTES.matcher(result).replaceAll("\"");
        result = result.toLowerCase(Locale.ROOT);
        result = COMBINING_MARKS.matcher(Normalizer.normalize(result, Normalizer.Form.NFD)).replaceAll("");
        result = NON_WORD.matcher(result).replaceAll("");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * @return true when both titles reduce to the same non-empty comparison form
     */
    public static boolean titlesMatch(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }

    /**
     * Jaccard index over the normalized word sets of both titles
     *
     * @return similarity in [0, 1]; 0.0 when either side has no words
     */
    public static double similarity(String a, String b) {
        Set<String> left = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> words(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }

    /**
     * @return true when either year is unknown or they differ by at most {@code tolerance}
     */
    public static boolean yearsCompatible(Integer a, Integer b, int tolerance) {
        if (a == null || b == null) {
            return true;
        }
        return Math.abs(a - b) <= tolerance;
    }

    /**
     * Pulls a release year out of free text. A parenthesized year wins over a bare one,
     * so "2001: A Space Odyssey (1968)" yields 1968.
     *
     * @return the year, or null when none is present
     */
    public static Integer extractYear(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher parenthesized = PARENTHESIZED_YEAR.matcher(text);
        while (parenthesized.find()) {
            int year = Integer.parseInt(parenthesized.group(1));
            if (year >= MIN_FILM_YEAR && year <= MAX_FILM_YEAR) {
                return year;
            }
        }
        Matcher bare = BARE_YEAR.matcher(text);
        if (bare.find()) {
            return Integer.parseInt(bare.group(1));
        }
        return null;
    }

    /**
     * Finds an IMDB id in text such as file names, Plex GUIDs or URLs
     *
     * @return lowercase id like tt0133093, or null
     */
    public static String extractImdbId(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Pattern pattern : IMDB_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1).toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }

    /**
     * @return the id lowercased and trimmed when it looks like tt + 7-8 digits, otherwise null
     */
    public static String normalizeImdbId(String id) {
        if (id == null) {
            return null;
        }
        String candidate = id.trim().toLowerCase(Locale.ROOT);
        return VALID_IMDB.matcher(candidate).matches() ? candidate : null;
    }

    /**
     * Cleans a scraped or API-supplied description for storage.
     * Decodes entities, strips tags and control characters, and normalizes whitespace per line.
     *
     * @return cleaned text, empty for null input
     */
    public static String sanitizeDescription(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = LINE_BREAK_TAG.matcher(text).replaceAll("\n");
        result = Parser.unescapeEntities(result, false);
        result = HTML_TAG.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        return Arrays.stream(result.split("\n"))
            .map(line -> WHITESPACE.matcher(line).replaceAll(" ").trim())
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"))
            .trim();
    }

    /**
     * Rejects text that is too short to be a synopsis or that came from a login or error page
     */
    public static boolean isValidDescription(String description) {
        if (description == null || description.strip().length() < MIN_DESCRIPTION_LENGTH) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        for (String marker : INVALID_DESCRIPTION_MARKERS) {
            if (lower.contains(marker)) {
                return false;
            }
        }
        return description.trim().split("\\s+").length >= MIN_DESCRIPTION_WORDS;
    }

    /**
     * Filesystem- and key-safe slug of a title: [a-z0-9-] only.
     * Long slugs are cut and suffixed with a hash so distinct titles stay distinct.
     * Titles whose letters or digits fall outside a-z0-9 (CJK, Cyrillic, ß) get a hash of the
     * normalized title appended for the same reason.
     *
     * @return slug; "unknown" when the title has no letters or digits at all
     */
    public static String slugForCacheKey(String text) {
        String normalized = normalize(text);
        String slug = normalized.replace(' ', '-');
        slug = NON_SLUG.matcher(slug).replaceAll("");
        slug = REPEATED_HYPHENS.matcher(slug).replaceAll("-");
        slug = trimHyphens(slug);
        boolean lossy = NON_ASCII_ALNUM.matcher(normalized).find();
        if (slug.isEmpty()) {
            return lossy ? "unknown-" + shortHash(normalized) : "unknown";
        }
        if (lossy) {
            return truncate(slug, MAX_SLUG_LENGTH - 9) + "-" + shortHash(normalized);
        }
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = truncate(slug, MAX_SLUG_LENGTH - 9) + "-" + shortHash(slug);
        }
        return slug;
    }

    private static String truncate(String slug, int maxLength) {
        return slug.length() > maxLength ? trimHyphens(slug.substring(0, maxLength)) : slug;
    }

    private static String shortHash(String text) {
        return sha256Hex(text).substring(0, 8);
    }

    private static String trimHyphens(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '-') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '-') {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * @return lowercase hex SHA-256 of the UTF-8 bytes of {@code text}
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
