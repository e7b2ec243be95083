/**
 * Main application class for Cinema Lookup
 *
 * @author William Callahan
 *
 * Features:
 * - Boots the resolution pipeline (POMS, TMDB alternate titles, web fallback)
 * - Binds all app.* configuration through AppConfigurationProperties
 * - Supports asynchronous lookups on a dedicated executor
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.cinema_lookup;

import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class CinemaLookupApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CinemaLookupApplication.class);

    private final AppConfigurationProperties properties;

    public CinemaLookupApplication(AppConfigurationProperties properties) {
        this.properties = properties;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(CinemaLookupApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Cinema lookup ready. Cache dir: {}, credential file: {}, TMDB configured: {}",
            properties.getCache().getDir(),
            properties.getCredentials().getFile(),
            properties.getAlternate().getApiKey() != null && !properties.getAlternate().getApiKey().isBlank());
    }
}
