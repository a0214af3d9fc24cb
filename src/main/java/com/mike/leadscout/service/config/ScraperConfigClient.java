package com.mike.leadscout.service.config;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.dto.ScraperConfigDocument;
import com.mike.leadscout.entity.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Reads the per-platform scraper config document from the config service.
 * Every failure surfaces as {@link ConfigFetchException}.
 */
@Component
@Slf4j
public class ScraperConfigClient {

    public static final String TOKEN_HEADER = "X-Config-Token";
    static final String CONFIG_PATH = "/api/scraper-config/{platform}";

    private final ConfigServiceProperties props;
    private final RestClient restClient;

    public ScraperConfigClient(ConfigServiceProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .build();
    }

    public ScraperConfig fetch(Platform platform) {
        log.debug("ScraperConfigClient.fetch: requesting config platform={} baseUrl={}", platform, props.baseUrl());

        ScraperConfigDocument document;
        try {
            document = restClient.get()
                    .uri(CONFIG_PATH, platform.name())
                    .headers(headers -> {
                        if (props.token() != null && !props.token().isBlank()) {
                            headers.set(TOKEN_HEADER, props.token());
                        }
                    })
                    .retrieve()
                    .body(ScraperConfigDocument.class);
        } catch (RestClientResponseException e) {
            throw new ConfigFetchException("config service returned HTTP " + e.getStatusCode().value()
                    + " for platform " + platform + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new ConfigFetchException("config service unreachable for platform " + platform + ": " + e.getMessage(), e);
        }

        if (document == null || document.config() == null) {
            throw new ConfigFetchException("empty config document for platform " + platform);
        }

        ScraperConfig config = toScraperConfig(platform, document.config());
        log.info("ScraperConfigClient.fetch: got config platform={} version={} selectors={} updatedAt={}",
                platform, config.version(), config.selectors().size(), document.updatedAt());
        return config;
    }

    static ScraperConfig toScraperConfig(Platform platform, ScraperConfigDocument.ConfigBody body) {
        try {
            ScraperConfig.Timing timing = body.timing() == null
                    ? DefaultScraperConfig.TIMING
                    : new ScraperConfig.Timing(
                            body.timing().pageLoadDelay(),
                            body.timing().actionDelay(),
                            body.timing().scrollDelay());

            ScraperConfigDocument.RetryStrategyBody retry = body.retryStrategy();
            RetryPolicy retryPolicy = retry == null
                    ? RetryPolicy.defaults()
                    : new RetryPolicy(
                            retry.maxRetries(),
                            retry.backoffMs(),
                            retry.backoffMultiplier() == null
                                    ? RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER
                                    : retry.backoffMultiplier());

            return new ScraperConfig(platform, body.version(), body.selectors(), timing, retryPolicy);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigFetchException("invalid config document for platform " + platform + ": " + e.getMessage(), e);
        }
    }
}
