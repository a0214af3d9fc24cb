package com.mike.leadscout.service.config;

import com.mike.leadscout.config.ConfigServiceProperties;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class ScraperConfigClientTest {

    private static final String SLACK_DOCUMENT = """
            {
              "platform": "SLACK",
              "config": {
                "version": "1.4.0",
                "selectors": {
                  "messageContainer": ".c-message",
                  "messageText": ".c-message__body"
                },
                "timing": { "pageLoadDelay": 2000, "actionDelay": 500, "scrollDelay": 300 },
                "retryStrategy": { "maxRetries": 3, "backoffMs": 1000 }
              },
              "updated_at": "2026-01-10T10:00:00Z"
            }
            """;

    private MockRestServiceServer server;
    private ScraperConfigClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        ConfigServiceProperties props = new ConfigServiceProperties(
                "http://config.test", "secret", new ConfigServiceProperties.FetchRetry(0, 0, 1.0), null);
        client = new ScraperConfigClient(props, builder);
    }

    @Test
    @DisplayName("200 -> parsed config with token header sent")
    void fetch_parses_document() {
        //Arrange
        server.expect(requestTo("http://config.test/api/scraper-config/SLACK"))
                .andExpect(header(ScraperConfigClient.TOKEN_HEADER, "secret"))
                .andRespond(withSuccess(SLACK_DOCUMENT, MediaType.APPLICATION_JSON));
        //Act
        ScraperConfig config = client.fetch(Platform.SLACK);
        //Assert
        assertEquals(Platform.SLACK, config.platform());
        assertEquals("1.4.0", config.version());
        assertEquals(".c-message", config.selector("messageContainer").orElseThrow());
        assertEquals(300L, config.timing().scrollDelayMs());
        assertEquals(3, config.retryPolicy().maxRetries());
        assertEquals(1000L, config.retryPolicy().initialBackoffMs());
        assertEquals(2.0, config.retryPolicy().backoffMultiplier());
        server.verify();
    }

    @Test
    @DisplayName("500 -> ConfigFetchException")
    void server_error_is_fetch_failure() {
        //Arrange
        server.expect(requestTo("http://config.test/api/scraper-config/LINKEDIN"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        //Act + Assert
        ConfigFetchException e = assertThrows(ConfigFetchException.class, () -> client.fetch(Platform.LINKEDIN));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }

    @Test
    @DisplayName("document without config -> ConfigFetchException")
    void missing_config_is_fetch_failure() {
        //Arrange
        server.expect(requestTo("http://config.test/api/scraper-config/SLACK"))
                .andRespond(withSuccess("{\"platform\":\"SLACK\"}", MediaType.APPLICATION_JSON));
        //Act + Assert
        assertThrows(ConfigFetchException.class, () -> client.fetch(Platform.SLACK));
    }

    @Test
    @DisplayName("negative retry count in document -> ConfigFetchException")
    void invalid_retry_strategy_is_fetch_failure() {
        //Arrange
        server.expect(requestTo("http://config.test/api/scraper-config/SLACK"))
                .andRespond(withSuccess("""
                        {"platform":"SLACK","config":{"version":"1.0.0","selectors":{},
                         "retryStrategy":{"maxRetries":-1,"backoffMs":1000}}}
                        """, MediaType.APPLICATION_JSON));
        //Act + Assert
        assertThrows(ConfigFetchException.class, () -> client.fetch(Platform.SLACK));
    }

    @Test
    @DisplayName("no timing and no retry strategy -> defaults")
    void missing_sections_use_defaults() {
        //Arrange
        server.expect(requestTo("http://config.test/api/scraper-config/SLACK"))
                .andRespond(withSuccess("""
                        {"platform":"SLACK","config":{"version":"1.0.1","selectors":{"messageContainer":".m"}}}
                        """, MediaType.APPLICATION_JSON));
        //Act
        ScraperConfig config = client.fetch(Platform.SLACK);
        //Assert
        assertEquals(2000L, config.timing().pageLoadDelayMs());
        assertEquals(3, config.retryPolicy().maxRetries());
    }
}
