package com.mike.leadscout.config;

import com.mike.leadscout.dto.ScraperConfigDocument;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;

/**
 * Remote scraper configuration: where the scheduler fetches it from and,
 * under {@code platforms}, the documents this instance serves itself.
 */
@ConfigurationProperties(prefix = "leadscout.config-service")
public record ConfigServiceProperties(
        @DefaultValue("http://localhost:8080") String baseUrl,
        String token,
        @DefaultValue FetchRetry fetchRetry,
        Map<String, ScraperConfigDocument.ConfigBody> platforms
) {

    public ConfigServiceProperties {
        platforms = platforms == null ? Map.of() : Map.copyOf(platforms);
    }

    /**
     * Retry budget for the config read; small because the read is cheap and idempotent.
     */
    public record FetchRetry(
            @DefaultValue("2") int maxRetries,
            @DefaultValue("200") long initialBackoffMs,
            @DefaultValue("2.0") double backoffMultiplier
    ) {}
}
