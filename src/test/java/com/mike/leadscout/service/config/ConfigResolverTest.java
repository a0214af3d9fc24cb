package com.mike.leadscout.service.config;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.dto.FallbackSource;
import com.mike.leadscout.dto.ResolvedConfig;
import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Platform;
import com.mike.leadscout.service.retry.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ConfigResolverTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T10:00:00Z"), ZoneOffset.UTC);

    private ScraperConfigClient client;
    private ConfigStore configStore;
    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        client = mock(ScraperConfigClient.class);
        configStore = new ConfigStore();
        ConfigServiceProperties props = new ConfigServiceProperties(
                "http://localhost:0",
                null,
                new ConfigServiceProperties.FetchRetry(2, 10, 2.0),
                null
        );
        RetryExecutor retryExecutor = new RetryExecutor(ms -> { }, CLOCK);
        resolver = new ConfigResolver(client, configStore, retryExecutor, CLOCK, props);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("fetch succeeds -> remote config, stored as last known good")
        void remote_success_is_stored() {
            //Arrange
            when(client.fetch(Platform.SLACK)).thenReturn(config("1.3.0"));
            //Act
            ResolvedConfig resolved = resolver.resolve(Platform.SLACK);
            //Assert
            assertEquals(FallbackSource.REMOTE, resolved.source());
            assertFalse(resolved.isFallback());
            assertEquals("1.3.0", resolved.config().version());
            assertEquals(LocalDateTime.now(CLOCK), resolved.fetchedAt());
            assertEquals("1.3.0", configStore.lastKnownGood(Platform.SLACK).orElseThrow().config().version());
        }

        @Test
        @DisplayName("fetch fails, earlier success -> last known good")
        void failure_uses_last_known_good() {
            //Arrange
            when(client.fetch(Platform.SLACK))
                    .thenReturn(config("1.3.0"))
                    .thenThrow(new ConfigFetchException("config service unreachable"));
            resolver.resolve(Platform.SLACK);
            //Act
            ResolvedConfig resolved = resolver.resolve(Platform.SLACK);
            //Assert
            assertEquals(FallbackSource.LAST_KNOWN_GOOD, resolved.source());
            assertTrue(resolved.isFallback());
            assertEquals("1.3.0", resolved.config().version());
        }

        @Test
        @DisplayName("fetch fails, nothing stored -> default config")
        void failure_without_history_uses_default() {
            //Arrange
            when(client.fetch(Platform.LINKEDIN)).thenThrow(new ConfigFetchException("HTTP 500"));
            //Act
            ResolvedConfig resolved = resolver.resolve(Platform.LINKEDIN);
            //Assert
            assertEquals(FallbackSource.DEFAULT, resolved.source());
            assertEquals(DefaultScraperConfig.VERSION, resolved.config().version());
            assertEquals(RetryPolicy.defaults(), resolved.config().retryPolicy());
            assertNull(resolved.fetchedAt());
        }

        @Test
        @DisplayName("fetch is retried within the fetch budget")
        void fetch_is_retried() {
            //Arrange
            when(client.fetch(Platform.SLACK))
                    .thenThrow(new ConfigFetchException("timeout"))
                    .thenReturn(config("2.0.0"));
            //Act
            ResolvedConfig resolved = resolver.resolve(Platform.SLACK);
            //Assert
            assertEquals(FallbackSource.REMOTE, resolved.source());
            verify(client, times(2)).fetch(Platform.SLACK);
        }

        @Test
        @DisplayName("fallback never overwrites last known good")
        void fallback_does_not_overwrite_store() {
            //Arrange
            when(client.fetch(Platform.SLACK))
                    .thenReturn(config("1.0.0"))
                    .thenThrow(new ConfigFetchException("down"));
            resolver.resolve(Platform.SLACK);
            LocalDateTime storedAt = configStore.lastKnownGood(Platform.SLACK).orElseThrow().fetchedAt();
            //Act
            resolver.resolve(Platform.SLACK);
            resolver.resolve(Platform.SLACK);
            //Assert
            ConfigStore.StoredConfig stored = configStore.lastKnownGood(Platform.SLACK).orElseThrow();
            assertEquals("1.0.0", stored.config().version());
            assertEquals(storedAt, stored.fetchedAt());
        }

        @Test
        @DisplayName("platforms fall back independently")
        void platforms_are_independent() {
            //Arrange
            when(client.fetch(Platform.SLACK)).thenReturn(config("1.0.0"));
            when(client.fetch(Platform.LINKEDIN)).thenThrow(new ConfigFetchException("down"));
            //Act
            ResolvedConfig slack = resolver.resolve(Platform.SLACK);
            ResolvedConfig linkedin = resolver.resolve(Platform.LINKEDIN);
            //Assert
            assertEquals(FallbackSource.REMOTE, slack.source());
            assertEquals(FallbackSource.DEFAULT, linkedin.source());
        }
    }

    private static ScraperConfig config(String version) {
        return new ScraperConfig(Platform.SLACK, version, Map.of("messageContainer", ".c-message"),
                new ScraperConfig.Timing(2000, 500, 300), new RetryPolicy(3, 1000, 2.0));
    }
}
