package com.mike.leadscout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "leadscout")
public class LeadScoutProperties {

    private Scheduler scheduler = new Scheduler();
    private Scraper scraper = new Scraper();

    @Data
    public static class Scheduler {
        /**
         * Interval between ticks for channels that do not define their own.
         */
        private long defaultIntervalMs = 900_000;

        /**
         * Worker threads shared by all channel timers.
         */
        private int poolSize = 4;
    }

    @Data
    public static class Scraper {
        private boolean headless = true;

        /** timeout for navigation and selector waits */
        private int pageTimeoutMs = 30000;

        /** safety limit per channel per run */
        private int maxPostsPerRun = 50;

        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                        "AppleWebKit/537.36 (KHTML, like Gecko) " +
                        "Chrome/120.0.0.0 Safari/537.36";
    }
}
