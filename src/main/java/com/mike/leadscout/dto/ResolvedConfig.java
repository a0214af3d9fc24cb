package com.mike.leadscout.dto;

import java.time.LocalDateTime;

/**
 * @param fetchedAt when the underlying config was fetched remotely; null for the default fallback
 */
public record ResolvedConfig(ScraperConfig config, FallbackSource source, LocalDateTime fetchedAt) {

    public boolean isFallback() {
        return source != FallbackSource.REMOTE;
    }
}
