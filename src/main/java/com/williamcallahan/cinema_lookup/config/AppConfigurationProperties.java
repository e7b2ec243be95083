/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for better type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.cinema_lookup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Credentials credentials = new Credentials();

    @NestedConfigurationProperty
    private Matching matching = new Matching();

    @NestedConfigurationProperty
    private Http http = new Http();

    @NestedConfigurationProperty
    private Primary primary = new Primary();

    @NestedConfigurationProperty
    private Alternate alternate = new Alternate();

    @NestedConfigurationProperty
    private Web web = new Web();

    // Getters and setters
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Credentials getCredentials() { return credentials; }
    public void setCredentials(Credentials credentials) { this.credentials = credentials; }

    public Matching getMatching() { return matching; }
    public void setMatching(Matching matching) { this.matching = matching; }

    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }

    public Primary getPrimary() { return primary; }
    public void setPrimary(Primary primary) { this.primary = primary; }

    public Alternate getAlternate() { return alternate; }
    public void setAlternate(Alternate alternate) { this.alternate = alternate; }

    public Web getWeb() { return web; }
    public void setWeb(Web web) { this.web = web; }

    // Nested configuration classes
    public static class Cache {
        private String dir = "cache";
        private Duration foundTtl = Duration.ofDays(30);
        private Duration notFoundTtl = Duration.ofDays(7);
        private int maxEntries = 10_000;
        private long maxSizeMb = 500;
        private double evictionFraction = 0.10;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }

        public Duration getFoundTtl() { return foundTtl; }
        public void setFoundTtl(Duration foundTtl) { this.foundTtl = foundTtl; }

        public Duration getNotFoundTtl() { return notFoundTtl; }
        public void setNotFoundTtl(Duration notFoundTtl) { this.notFoundTtl = notFoundTtl; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public long getMaxSizeMb() { return maxSizeMb; }
        public void setMaxSizeMb(long maxSizeMb) { this.maxSizeMb = maxSizeMb; }

        public double getEvictionFraction() { return evictionFraction; }
        public void setEvictionFraction(double evictionFraction) { this.evictionFraction = evictionFraction; }
    }

    public static class Credentials {
        private String file = "cache/credentials.json";
        private String sourceUrl = "https://www.vprogids.nl/cinema/zoek.html";
        private Duration cooldown = Duration.ofSeconds(60);
        private String defaultApiKey = "ione7ahfij";
        private String defaultApiSecret = "aag9veesei";

        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }

        public String getSourceUrl() { return sourceUrl; }
        public void setSourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; }

        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

        public String getDefaultApiKey() { return defaultApiKey; }
        public void setDefaultApiKey(String defaultApiKey) { this.defaultApiKey = defaultApiKey; }

        public String getDefaultApiSecret() { return defaultApiSecret; }
        public void setDefaultApiSecret(String defaultApiSecret) { this.defaultApiSecret = defaultApiSecret; }
    }

    public static class Matching {
        private double similarityThreshold = 0.75;
        private int yearTolerance = 2;

        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }

        public int getYearTolerance() { return yearTolerance; }
        public void setYearTolerance(int yearTolerance) { this.yearTolerance = yearTolerance; }
    }

    public static class Http {
        private int maxRetries = 3;
        private Duration backoffBase = Duration.ofSeconds(2);
        private Duration requestTimeout = Duration.ofSeconds(15);
        private Duration rateLimitWait = Duration.ofSeconds(60);
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";
        private int maxConnectionsPerHost = 10;

        @NestedConfigurationProperty
        private RateLimit defaultRateLimit = new RateLimit(2.0, 2);

        /** Keyed by host fragment; the longest fragment contained in a request host wins. */
        private Map<String, RateLimit> rateLimits = defaultRateLimits();

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public Duration getRateLimitWait() { return rateLimitWait; }
        public void setRateLimitWait(Duration rateLimitWait) { this.rateLimitWait = rateLimitWait; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public int getMaxConnectionsPerHost() { return maxConnectionsPerHost; }
        public void setMaxConnectionsPerHost(int maxConnectionsPerHost) { this.maxConnectionsPerHost = maxConnectionsPerHost; }

        public RateLimit getDefaultRateLimit() { return defaultRateLimit; }
        public void setDefaultRateLimit(RateLimit defaultRateLimit) { this.defaultRateLimit = defaultRateLimit; }

        public Map<String, RateLimit> getRateLimits() { return rateLimits; }
        public void setRateLimits(Map<String, RateLimit> rateLimits) { this.rateLimits = rateLimits; }

        private static Map<String, RateLimit> defaultRateLimits() {
            Map<String, RateLimit> limits = new LinkedHashMap<>();
            limits.put("rs.poms.omroep.nl", new RateLimit(5.0, 3));
            limits.put("api.themoviedb.org", new RateLimit(4.0, 5));
            limits.put("duckduckgo.com", new RateLimit(0.5, 2));
            limits.put("startpage.com", new RateLimit(0.5, 1));
            limits.put("vprogids.nl", new RateLimit(2.0, 3));
            limits.put("cinema.nl", new RateLimit(2.0, 3));
            return limits;
        }
    }

    public static class RateLimit {
        private double requestsPerSecond;
        private int burst;

        public RateLimit() {
            this(1.0, 1);
        }

        public RateLimit(double requestsPerSecond, int burst) {
            this.requestsPerSecond = requestsPerSecond;
            this.burst = burst;
        }

        public double getRequestsPerSecond() { return requestsPerSecond; }
        public void setRequestsPerSecond(double requestsPerSecond) { this.requestsPerSecond = requestsPerSecond; }

        public int getBurst() { return burst; }
        public void setBurst(int burst) { this.burst = burst; }
    }

    public static class Primary {
        private String baseUrl = "https://rs.poms.omroep.nl/v1/api";
        private String origin = "https://www.vprogids.nl";
        private String profile = "vprocinema";
        private int maxResults = 10;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getOrigin() { return origin; }
        public void setOrigin(String origin) { this.origin = origin; }

        public String getProfile() { return profile; }
        public void setProfile(String profile) { this.profile = profile; }

        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
    }

    public static class Alternate {
        private String baseUrl = "https://api.themoviedb.org/3";
        private String apiKey;
        private int maxTitles = 5;
        private List<String> preferredCountries = new ArrayList<>(List.of("FR", "NL", "BE", "DE"));
        private Duration cacheTtl = Duration.ofHours(6);
        private long cacheSize = 1_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public int getMaxTitles() { return maxTitles; }
        public void setMaxTitles(int maxTitles) { this.maxTitles = maxTitles; }

        public List<String> getPreferredCountries() { return preferredCountries; }
        public void setPreferredCountries(List<String> preferredCountries) { this.preferredCountries = preferredCountries; }

        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }

        public long getCacheSize() { return cacheSize; }
        public void setCacheSize(long cacheSize) { this.cacheSize = cacheSize; }
    }

    public static class Web {
        private String cinemaBaseUrl = "https://www.cinema.nl";
        private int maxResultsPerEngine = 5;

        public String getCinemaBaseUrl() { return cinemaBaseUrl; }
        public void setCinemaBaseUrl(String cinemaBaseUrl) { this.cinemaBaseUrl = cinemaBaseUrl; }

        public int getMaxResultsPerEngine() { return maxResultsPerEngine; }
        public void setMaxResultsPerEngine(int maxResultsPerEngine) { this.maxResultsPerEngine = maxResultsPerEngine; }
    }
}
