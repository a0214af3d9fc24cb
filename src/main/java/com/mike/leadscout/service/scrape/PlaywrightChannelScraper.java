package com.mike.leadscout.service.scrape;

import com.microsoft.playwright.*;
import com.microsoft.playwright.options.WaitUntilState;
import com.mike.leadscout.config.LeadScoutProperties;
import com.mike.leadscout.dto.ScrapedPost;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads posts from a channel page with Chromium. Each call launches a fresh browser and a
 * new context with no stored cookies, so only pages readable without a login yield posts.
 * Selectors and delays come from the resolved {@link ScraperConfig}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaywrightChannelScraper implements ChannelScraper {

    // Slack configs name the item "message*", LinkedIn configs "post*"
    private static final List<String> CONTAINER_KEYS = List.of("messageContainer", "postContainer");
    private static final List<String> TEXT_KEYS = List.of("messageText", "postText");
    private static final List<String> AUTHOR_KEYS = List.of("messageSender", "postAuthor");
    private static final List<String> TIMESTAMP_KEYS = List.of("messageTimestamp", "postTimestamp");
    private static final List<String> PERMALINK_KEYS = List.of("messagePermalink", "postPermalink");
    // name of a container attribute holding a stable id, e.g. LinkedIn's data-urn
    private static final String EXTERNAL_ID_ATTRIBUTE_KEY = "externalIdAttribute";

    private static final int SCROLL_STEP_PX = 2000;

    private final LeadScoutProperties props;

    @Override
    public List<ScrapedPost> scrape(Channel channel, ScraperConfig config) {
        if (channel.getSearchUrl() == null || channel.getSearchUrl().isBlank()) {
            throw new ScrapeExecutionException("channel " + channel.getId() + " has no search url");
        }
        String containerSelector = firstSelector(config, CONTAINER_KEYS)
                .orElseThrow(() -> new ScrapeExecutionException(
                        "config " + config.version() + " has no post container selector for " + config.platform()));

        LeadScoutProperties.Scraper scraperProps = props.getScraper();

        try (Playwright pw = Playwright.create()) {
            Browser browser = pw.chromium().launch(
                    new BrowserType.LaunchOptions()
                            .setHeadless(scraperProps.isHeadless())
                            .setArgs(List.of("--no-sandbox", "--disable-dev-shm-usage"))
            );

            try (BrowserContext ctx = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(scraperProps.getUserAgent()))) {
                Page page = ctx.newPage();
                page.setDefaultTimeout(scraperProps.getPageTimeoutMs());
                page.setDefaultNavigationTimeout(scraperProps.getPageTimeoutMs());

                log.info("PlaywrightChannelScraper: channel={} navigating to {}", channel.getId(), channel.getSearchUrl());
                page.navigate(channel.getSearchUrl(),
                        new Page.NavigateOptions().setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
                page.waitForTimeout(config.timing().pageLoadDelayMs());

                page.waitForSelector(containerSelector);
                page.mouse().wheel(0, SCROLL_STEP_PX);
                page.waitForTimeout(config.timing().scrollDelayMs());

                return extractPosts(page, channel, config, containerSelector);
            } finally {
                try {
                    browser.close();
                } catch (PlaywrightException e) {
                    log.debug("PlaywrightChannelScraper: browser close failed: {}", e.getMessage());
                }
            }
        } catch (PlaywrightException e) {
            throw new ScrapeExecutionException("browser failure for channel " + channel.getId() + ": " + e.getMessage(), e);
        }
    }

    private List<ScrapedPost> extractPosts(Page page, Channel channel, ScraperConfig config, String containerSelector) {
        Optional<String> textSelector = firstSelector(config, TEXT_KEYS);
        Optional<String> authorSelector = firstSelector(config, AUTHOR_KEYS);
        Optional<String> timestampSelector = firstSelector(config, TIMESTAMP_KEYS);
        Optional<String> permalinkSelector = firstSelector(config, PERMALINK_KEYS);
        Optional<String> idAttribute = config.selector(EXTERNAL_ID_ATTRIBUTE_KEY);

        Locator items = page.locator(containerSelector);
        int count = Math.min(items.count(), props.getScraper().getMaxPostsPerRun());

        List<ScrapedPost> posts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Locator item = items.nth(i);

            String content = textSelector
                    .map(sel -> firstText(item, sel))
                    .orElseGet(item::innerText);
            if (content == null || content.isBlank()) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("channelName", channel.getName());
            metadata.put("configVersion", config.version());
            authorSelector.map(sel -> firstText(item, sel)).ifPresent(a -> metadata.put("author", a));
            timestampSelector.map(sel -> firstText(item, sel)).ifPresent(t -> metadata.put("displayedTime", t));

            String permalink = permalinkSelector
                    .map(sel -> firstAttribute(item, sel, "href"))
                    .orElse(null);

            String externalId = permalink != null
                    ? permalink
                    : idAttribute.map(item::getAttribute).filter(id -> !id.isBlank()).orElse(null);

            posts.add(new ScrapedPost(externalId, LocalDateTime.now(), content.trim(),
                    permalink != null ? permalink : page.url(), metadata));

            page.waitForTimeout(config.timing().actionDelayMs());
        }

        log.info("PlaywrightChannelScraper: channel={} -> {} posts (containers={})",
                channel.getId(), posts.size(), items.count());
        return posts;
    }

    private static Optional<String> firstSelector(ScraperConfig config, List<String> keys) {
        return keys.stream()
                .map(config::selector)
                .flatMap(Optional::stream)
                .findFirst();
    }

    private static String firstText(Locator item, String selector) {
        Locator found = item.locator(selector);
        if (found.count() == 0) return null;
        return found.first().innerText();
    }

    private static String firstAttribute(Locator item, String selector, String attribute) {
        Locator found = item.locator(selector);
        if (found.count() == 0) return null;
        return found.first().getAttribute(attribute);
    }
}
