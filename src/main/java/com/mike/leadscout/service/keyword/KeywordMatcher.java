package com.mike.leadscout.service.keyword;

import com.mike.leadscout.entity.Post;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Case-insensitive substring matching of post content against a keyword set.
 * Favors recall: a false positive costs the user one dismissal, a miss costs a lead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordMatcher {

    private final PostContentNormalizer normalizer;

    public Set<String> match(Post post, Collection<String> activeKeywords) {
        return match(post == null ? null : post.getContent(), activeKeywords);
    }

    /**
     * @return the keywords (as the user spelled them) found in the content; empty means no lead
     */
    public Set<String> match(String content, Collection<String> activeKeywords) {
        if (activeKeywords == null || activeKeywords.isEmpty()) return Set.of();

        List<String> haystacks;
        try {
            haystacks = normalizer.toSearchableTexts(content);
        } catch (MatchingException e) {
            log.warn("KeywordMatcher: unsearchable content, treating as no match: {}", e.getMessage());
            return Set.of();
        }

        Set<String> matched = new LinkedHashSet<>();
        for (String keyword : activeKeywords) {
            String needle = normalizer.normalizeKeyword(keyword);
            if (needle.isEmpty()) continue;
            for (String haystack : haystacks) {
                if (haystack.contains(needle)) {
                    matched.add(keyword.trim());
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(matched);
    }
}
