package com.mike.leadscout.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Wire shape of {@code GET /api/scraper-config/{platform}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScraperConfigDocument(
        String platform,
        ConfigBody config,
        @JsonProperty("updated_at") String updatedAt
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConfigBody(
            String version,
            Map<String, String> selectors,
            TimingBody timing,
            RetryStrategyBody retryStrategy
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TimingBody(long pageLoadDelay, long actionDelay, long scrollDelay) {}

    /**
     * {@code backoffMultiplier} is optional on the wire; absent means doubling.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryStrategyBody(int maxRetries, long backoffMs, Double backoffMultiplier) {}
}
