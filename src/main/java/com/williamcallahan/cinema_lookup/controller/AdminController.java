/**
 * REST controller for administrative operations
 *
 * @author William Callahan
 *
 * Features:
 * - Disk cache statistics, full clear and single-entry delete
 * - Clearing never removes the persisted credential file
 * - Credential state inspection (key masked) and manual refresh
 */
package com.williamcallahan.cinema_lookup.controller;

import com.williamcallahan.cinema_lookup.controller.support.ErrorResponseUtils;
import com.williamcallahan.cinema_lookup.credentials.CredentialManager;
import com.williamcallahan.cinema_lookup.credentials.CredentialStore;
import com.williamcallahan.cinema_lookup.model.Credentials;
import com.williamcallahan.cinema_lookup.service.cache.CacheStats;
import com.williamcallahan.cinema_lookup.service.cache.DiskCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final DiskCacheService diskCache;
    private final CredentialManager credentialManager;
    private final CredentialStore credentialStore;

    public AdminController(DiskCacheService diskCache,
                           CredentialManager credentialManager,
                           CredentialStore credentialStore) {
        this.diskCache = diskCache;
        this.credentialManager = credentialManager;
        this.credentialStore = credentialStore;
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(diskCache.stats());
    }

    /**
     * Removes every cached lookup; the credential file is preserved even when it lives in the cache directory
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        Path credentialFile = credentialStore.getFile().toAbsolutePath().normalize();
        int removed = diskCache.clear(path -> path.toAbsolutePath().normalize().equals(credentialFile));
        logger.info("Admin cleared the disk cache: {} entries removed", removed);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/cache/{key}")
    public ResponseEntity<Map<String, Object>> deleteEntry(@PathVariable String key) {
        if (!diskCache.delete(key)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        logger.info("Admin deleted cache entry {}", key);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deleted", key);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/credentials")
    public ResponseEntity<Map<String, Object>> credentials() {
        return ResponseEntity.ok(credentialSummary());
    }

    @PostMapping("/credentials/refresh")
    public ResponseEntity<Map<String, Object>> refreshCredentials() {
        boolean refreshed = credentialManager.forceRefresh();
        logger.info("Admin-triggered credential refresh: {}", refreshed ? "success" : "no new credentials");
        Map<String, Object> body = credentialSummary();
        body.put("refreshed", refreshed);
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> credentialSummary() {
        Credentials current = credentialManager.currentCredentials();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", credentialManager.state().name());
        body.put("api_key", current.maskedKey());
        body.put("source", current.source());
        body.put("fetched_at", current.fetchedAt());
        credentialManager.lastRefreshAttempt().ifPresent(at -> body.put("last_refresh_attempt", at));
        return body;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ErrorResponseUtils.badRequest("Invalid request", ex);
    }
}
