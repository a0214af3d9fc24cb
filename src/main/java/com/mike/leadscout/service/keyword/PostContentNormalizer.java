package com.mike.leadscout.service.keyword;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns scraped post content into lower-case, single-spaced text for substring matching.
 * <p>
 * The raw content is always searchable. Content that looks like markup also yields its
 * extracted text, since a phrase can be split by tags. Bracketed plain text (Slack's
 * {@code <url|label>}, {@code <@U123>}) stays visible through the raw form.
 */
@Component
@Slf4j
public class PostContentNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HTML_TAG = Pattern.compile("<[a-zA-Z/!][^>]*>");

    /**
     * @return the normalized raw content, followed by the normalized html text when it differs
     */
    public List<String> toSearchableTexts(String content) {
        if (content == null) {
            throw new MatchingException("post content is null");
        }

        List<String> texts = new ArrayList<>(2);
        String raw = normalize(content);
        texts.add(raw);

        if (HTML_TAG.matcher(content).find()) {
            try {
                String extracted = normalize(Jsoup.parse(content).text());
                if (!extracted.isEmpty() && !extracted.equals(raw)) {
                    texts.add(extracted);
                }
            } catch (RuntimeException e) {
                log.warn("PostContentNormalizer: html text extraction failed, matching raw content only: {}", e.getMessage());
            }
        }
        return texts;
    }

    public String normalizeKeyword(String keyword) {
        if (keyword == null) return "";
        return normalize(keyword);
    }

    private static String normalize(String value) {
        return WHITESPACE.matcher(value).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }
}
