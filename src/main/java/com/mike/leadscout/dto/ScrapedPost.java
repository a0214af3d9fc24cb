package com.mike.leadscout.dto;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * A post as read from the page, before it is stored.
 */
public record ScrapedPost(
        String externalId,
        LocalDateTime timestamp,
        String content,
        String sourceUrl,
        Map<String, Object> metadata
) {
    public ScrapedPost {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
