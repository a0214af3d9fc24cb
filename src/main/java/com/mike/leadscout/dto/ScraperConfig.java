package com.mike.leadscout.dto;

import com.mike.leadscout.entity.Platform;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned scraping configuration for one platform. A newer fetch produces a new
 * instance; existing instances never change.
 */
public record ScraperConfig(
        Platform platform,
        String version,
        Map<String, String> selectors,
        Timing timing,
        RetryPolicy retryPolicy
) {

    public ScraperConfig {
        Objects.requireNonNull(platform, "platform");
        if (version == null || version.isBlank()) throw new IllegalArgumentException("version is required");
        selectors = selectors == null ? Map.of() : Map.copyOf(selectors);
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public Optional<String> selector(String key) {
        String value = selectors.get(key);
        if (value == null || value.isBlank()) return Optional.empty();
        return Optional.of(value);
    }

    public record Timing(long pageLoadDelayMs, long actionDelayMs, long scrollDelayMs) {
        public Timing {
            if (pageLoadDelayMs < 0 || actionDelayMs < 0 || scrollDelayMs < 0) {
                throw new IllegalArgumentException("timing values must be >= 0");
            }
        }
    }
}
