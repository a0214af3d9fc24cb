package com.mike.leadscout.dto;

import java.util.Locale;

/**
 * Where a resolved scraper config came from.
 */
public enum FallbackSource {
    REMOTE, LAST_KNOWN_GOOD, DEFAULT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
