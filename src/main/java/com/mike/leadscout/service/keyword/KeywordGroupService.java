package com.mike.leadscout.service.keyword;

import com.mike.leadscout.entity.UserKeywordGroup;
import com.mike.leadscout.repository.UserKeywordGroupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class KeywordGroupService {

    public static final int MIN_KEYWORD_LENGTH = 2;
    public static final int MAX_KEYWORD_LENGTH = 50;

    private final UserKeywordGroupRepository repository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<UserKeywordGroup> activeGroup(Long userId) {
        return repository.findFirstByUserIdAndActiveTrueOrderByUpdatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<String> activeKeywords(Long userId) {
        return activeGroup(userId)
                .map(group -> List.copyOf(group.getKeywords()))
                .orElse(List.of());
    }

    /**
     * Stores a new active group for the user and deactivates the previous ones.
     */
    @Transactional
    public UserKeywordGroup replaceActiveGroup(Long userId, List<String> keywords) {
        List<String> cleaned = validate(keywords);
        LocalDateTime now = LocalDateTime.now(clock);

        List<UserKeywordGroup> previous = repository.findByUserIdAndActiveTrue(userId);
        for (UserKeywordGroup group : previous) {
            group.setActive(false);
            group.setUpdatedAt(now);
        }
        repository.saveAll(previous);

        UserKeywordGroup group = UserKeywordGroup.builder()
                .userId(userId)
                .active(true)
                .keywords(new ArrayList<>(cleaned))
                .createdAt(now)
                .updatedAt(now)
                .build();
        UserKeywordGroup saved = repository.save(group);

        log.info("KeywordGroupService: userId={} new active group id={} keywords={} deactivated={}",
                userId, saved.getId(), cleaned.size(), previous.size());
        return saved;
    }

    /**
     * Trims, checks the 2-50 character bound and drops case-insensitive duplicates
     * (first spelling wins).
     */
    public List<String> validate(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            throw new InvalidKeywordException("at least one keyword is required");
        }

        List<String> cleaned = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String raw : keywords) {
            if (raw == null) {
                throw new InvalidKeywordException("keyword must not be null");
            }
            String keyword = raw.trim();
            if (keyword.length() < MIN_KEYWORD_LENGTH || keyword.length() > MAX_KEYWORD_LENGTH) {
                throw new InvalidKeywordException("keyword '" + keyword + "' must be between "
                        + MIN_KEYWORD_LENGTH + " and " + MAX_KEYWORD_LENGTH + " characters");
            }
            if (seen.add(keyword.toLowerCase(Locale.ROOT))) {
                cleaned.add(keyword);
            }
        }
        return cleaned;
    }
}
