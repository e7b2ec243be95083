/**
 * REST controller for synopsis lookups
 *
 * @author William Callahan
 *
 * Features:
 * - Single lookup endpoint backed by the resolution orchestrator
 * - Runs lookups on the lookup executor so request threads are released
 * - Blank titles and unknown media types answered with 400
 */
package com.williamcallahan.cinema_lookup.controller;

import com.williamcallahan.cinema_lookup.controller.support.ErrorResponseUtils;
import com.williamcallahan.cinema_lookup.model.CacheRecord;
import com.williamcallahan.cinema_lookup.model.MediaType;
import com.williamcallahan.cinema_lookup.service.ResolutionOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@RestController
@RequestMapping("/api")
public class LookupController {

    private final ResolutionOrchestrator orchestrator;

    public LookupController(ResolutionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/lookup")
    public CompletableFuture<ResponseEntity<CacheRecord>> lookup(@RequestParam String title,
                                                                 @RequestParam(required = false) Integer year,
                                                                 @RequestParam(name = "mediaType", required = false) String mediaType,
                                                                 @RequestParam(name = "externalId", required = false) String externalId) {
        return orchestrator.resolveAsync(title, year, MediaType.fromValue(mediaType), externalId)
            .thenApply(ResponseEntity::ok)
            .exceptionally(ex -> {
                Throwable cause = ErrorResponseUtils.rootCause(ex);
                log.error("Lookup for '{}' failed: {}", title, cause.getMessage(), cause);
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
            });
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleInvalidLookup(IllegalArgumentException ex) {
        return ErrorResponseUtils.badRequest("Invalid lookup", ex);
    }
}
