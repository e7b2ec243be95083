package com.williamcallahan.cinema_lookup.util;

import com.williamcallahan.cinema_lookup.model.MediaType;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds and validates the deterministic keys lookups are cached under.
 * Format: {@code vpro-{title-slug}-{year|0}-{imdb|none}-{m|s}}
 */
public final class LookupKeys {

    public static final String PREFIX = "vpro-";
    private static final int MAX_KEY_LENGTH = 200;
    private static final Pattern SAFE_KEY = Pattern.compile("^vpro-[a-z0-9\\-]+$");

    private LookupKeys() {
    }

    public static String of(String title, Integer year, String externalId, MediaType mediaType) {
        String slug = TextUtils.slugForCacheKey(title);
        String yearPart = year != null && year > 0 ? String.valueOf(year) : "0";
        String imdbPart = externalId != null ? externalId.toLowerCase(Locale.ROOT) : "none";
        MediaType type = mediaType != null ? mediaType : MediaType.FILM;
        return PREFIX + slug + "-" + yearPart + "-" + imdbPart + "-" + type.getKeySuffix();
    }

    /**
     * Rejects keys that could escape the cache directory or were not produced by {@link #of}
     */
    public static boolean isValid(String key) {
        if (key == null || key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
            return false;
        }
        if (key.contains("..") || key.contains("/") || key.contains("\\")) {
            return false;
        }
        return SAFE_KEY.matcher(key).matches();
    }
}
