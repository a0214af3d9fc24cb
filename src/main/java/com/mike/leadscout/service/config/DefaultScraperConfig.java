package com.mike.leadscout.service.config;

import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Platform;

import java.util.Map;

/**
 * Hardcoded last-resort config: conservative timing, no selectors, default retry policy.
 */
public final class DefaultScraperConfig {

    public static final String VERSION = "1.0.0-fallback";

    static final ScraperConfig.Timing TIMING = new ScraperConfig.Timing(2000, 500, 300);

    private DefaultScraperConfig() {
    }

    public static ScraperConfig forPlatform(Platform platform) {
        return new ScraperConfig(platform, VERSION, Map.of(), TIMING, RetryPolicy.defaults());
    }
}
