package com.mike.leadscout.service.scrape;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mike.leadscout.dto.ScrapeCycleResult;
import com.mike.leadscout.dto.ScrapedPost;
import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Channel;
import com.mike.leadscout.entity.PlatformConnection;
import com.mike.leadscout.entity.Post;
import com.mike.leadscout.repository.PostRepository;
import com.mike.leadscout.service.keyword.KeywordGroupService;
import com.mike.leadscout.service.keyword.KeywordMatcher;
import com.mike.leadscout.service.lead.LeadService;
import com.mike.leadscout.service.lead.LeadUpsertOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One scrape-and-match pass over a channel: scrape, store new posts, match them against
 * the connection owner's active keywords, upsert leads. Safe to repeat after a partial
 * failure: known posts are reused and lead upserts are idempotent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScrapeCycleService {

    static final String CONTENT_KEY_PREFIX = "content:";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ChannelScraper channelScraper;
    private final PostRepository postRepository;
    private final KeywordGroupService keywordGroupService;
    private final KeywordMatcher keywordMatcher;
    private final LeadService leadService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ScrapeCycleResult runCycle(Channel channel, PlatformConnection connection, ScraperConfig config) {
        List<ScrapedPost> scraped = channelScraper.scrape(channel, config);
        List<String> keywords = keywordGroupService.activeKeywords(connection.getUserId());

        if (keywords.isEmpty()) {
            log.info("ScrapeCycleService: channel={} userId={} has no active keywords, posts stored without matching",
                    channel.getId(), connection.getUserId());
        }

        int stored = 0;
        int alreadyKnown = 0;
        int leadsCreated = 0;
        int leadsUpdated = 0;

        for (ScrapedPost scrapedPost : scraped) {
            String externalId = externalIdOf(channel.getId(), scrapedPost);
            Optional<Post> known = postRepository.findFirstByChannelIdAndExternalId(channel.getId(), externalId);
            Post post;
            if (known.isPresent()) {
                post = known.get();
                alreadyKnown++;
            } else {
                post = postRepository.save(toPost(channel.getId(), externalId, scrapedPost));
                stored++;
            }

            Set<String> matched = keywordMatcher.match(post, keywords);
            if (matched.isEmpty()) continue;

            LeadUpsertOutcome outcome = leadService.upsert(connection.getUserId(), post.getId(), matched);
            if (outcome == LeadUpsertOutcome.CREATED) leadsCreated++;
            else if (outcome == LeadUpsertOutcome.UPDATED) leadsUpdated++;
        }

        ScrapeCycleResult result = ScrapeCycleResult.builder()
                .postsFound(scraped.size())
                .postsStored(stored)
                .postsAlreadyKnown(alreadyKnown)
                .leadsCreated(leadsCreated)
                .leadsUpdated(leadsUpdated)
                .build();
        log.info("ScrapeCycleService: channel={} {}", channel.getId(), result.toLogLine());
        return result;
    }

    /**
     * The platform id when the scraper found one, otherwise a content key over channel,
     * author and whitespace-collapsed text. Displayed times are left out: they are relative
     * ("3h") and change between ticks.
     */
    static String externalIdOf(Long channelId, ScrapedPost scrapedPost) {
        if (scrapedPost.externalId() != null && !scrapedPost.externalId().isBlank()) {
            return scrapedPost.externalId();
        }
        Object author = scrapedPost.metadata().get("author");
        String text = scrapedPost.content() == null ? "" : WHITESPACE.matcher(scrapedPost.content()).replaceAll(" ").trim();
        String payload = channelId + "\n" + (author == null ? "" : author.toString().trim()) + "\n" + text;
        return CONTENT_KEY_PREFIX + sha256Hex(payload);
    }

    private static String sha256Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Post toPost(Long channelId, String externalId, ScrapedPost scrapedPost) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Post.builder()
                .channelId(channelId)
                .externalId(externalId)
                .postedAt(scrapedPost.timestamp() != null ? scrapedPost.timestamp() : now)
                .content(scrapedPost.content())
                .sourceUrl(scrapedPost.sourceUrl())
                .metadata(toJson(scrapedPost))
                .createdAt(now)
                .build();
    }

    private String toJson(ScrapedPost scrapedPost) {
        try {
            return objectMapper.writeValueAsString(scrapedPost.metadata());
        } catch (JsonProcessingException e) {
            log.warn("ScrapeCycleService: metadata not serializable, storing empty object: {}", e.getMessage());
            return "{}";
        }
    }
}
