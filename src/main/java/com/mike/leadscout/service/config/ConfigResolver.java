package com.mike.leadscout.service.config;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.dto.FallbackSource;
import com.mike.leadscout.dto.ResolvedConfig;
import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.RetryResult;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Platform;
import com.mike.leadscout.service.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Always returns a usable config: remote, else last known good, else the hardcoded default.
 */
@Service
@Slf4j
public class ConfigResolver {

    private final ScraperConfigClient client;
    private final ConfigStore configStore;
    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final RetryPolicy fetchPolicy;

    public ConfigResolver(ScraperConfigClient client,
                          ConfigStore configStore,
                          RetryExecutor retryExecutor,
                          Clock clock,
                          ConfigServiceProperties props) {
        this.client = client;
        this.configStore = configStore;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
        this.fetchPolicy = new RetryPolicy(
                props.fetchRetry().maxRetries(),
                props.fetchRetry().initialBackoffMs(),
                props.fetchRetry().backoffMultiplier());
    }

    public ResolvedConfig resolve(Platform platform) {
        RetryResult<ScraperConfig> fetched =
                retryExecutor.run("config fetch platform=" + platform, () -> client.fetch(platform), fetchPolicy);

        if (fetched.success()) {
            LocalDateTime fetchedAt = LocalDateTime.now(clock);
            configStore.storeLastKnownGood(fetched.value(), fetchedAt);
            log.info("ConfigResolver: platform={} version={} source={}",
                    platform, fetched.value().version(), FallbackSource.REMOTE.wireName());
            return new ResolvedConfig(fetched.value(), FallbackSource.REMOTE, fetchedAt);
        }

        Optional<ConfigStore.StoredConfig> lastKnownGood = configStore.lastKnownGood(platform);
        if (lastKnownGood.isPresent()) {
            ConfigStore.StoredConfig stored = lastKnownGood.get();
            log.warn("ConfigResolver: fetch failed after {} attempts ({}), platform={} source={} version={} fetchedAt={}",
                    fetched.attemptCount(), fetched.errorDetail(), platform,
                    FallbackSource.LAST_KNOWN_GOOD.wireName(), stored.config().version(), stored.fetchedAt());
            return new ResolvedConfig(stored.config(), FallbackSource.LAST_KNOWN_GOOD, stored.fetchedAt());
        }

        ScraperConfig fallback = configStore.defaultFallback(platform);
        log.warn("ConfigResolver: fetch failed after {} attempts ({}), platform={} source={} version={}",
                fetched.attemptCount(), fetched.errorDetail(), platform,
                FallbackSource.DEFAULT.wireName(), fallback.version());
        return new ResolvedConfig(fallback, FallbackSource.DEFAULT, null);
    }
}
