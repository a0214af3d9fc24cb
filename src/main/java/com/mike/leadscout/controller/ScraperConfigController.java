package com.mike.leadscout.controller;

import com.mike.leadscout.service.config.ScraperConfigCatalog;
import com.mike.leadscout.service.config.ScraperConfigClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Serves the versioned scraper config the scheduler (this or another instance) fetches
 * before each run.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ScraperConfigController {

    private final ScraperConfigCatalog catalog;

    @Value("${leadscout.config-service.token:}")
    private String configToken;

    @GetMapping("/api/scraper-config/{platform}")
    public ResponseEntity<?> getConfig(
            @RequestHeader(value = ScraperConfigClient.TOKEN_HEADER, required = false) String token,
            @PathVariable String platform
    ) {
        assertAuthorized(token);

        return catalog.find(platform)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    log.info("ScraperConfigController: unknown platform requested '{}'", platform);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                            "error", "Unknown platform: " + platform,
                            "supported_platforms", catalog.supportedPlatforms()
                    ));
                });
    }

    private void assertAuthorized(String token) {
        if (configToken != null && !configToken.isBlank()) {
            if (token == null || !configToken.equals(token)) {
                throw new UnauthorizedException();
            }
        }
    }

    @ResponseStatus(code = HttpStatus.UNAUTHORIZED, reason = "Authentication required")
    static class UnauthorizedException extends RuntimeException {}
}
