package com.mike.leadscout.service.keyword;

import com.mike.leadscout.entity.UserKeywordGroup;
import com.mike.leadscout.repository.UserKeywordGroupRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({KeywordGroupService.class, KeywordGroupServiceTest.ClockConfig.class})
class KeywordGroupServiceTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired
    private KeywordGroupService keywordGroupService;

    @Autowired
    private UserKeywordGroupRepository repository;

    @Test
    @DisplayName("replace -> trimmed, deduplicated, active")
    void replace_stores_cleaned_group() {
        //Act
        UserKeywordGroup group = keywordGroupService.replaceActiveGroup(1L,
                List.of("  React ", "react", "Node.js", "REACT"));
        //Assert
        assertTrue(group.isActive());
        assertEquals(List.of("React", "Node.js"), group.getKeywords());
        assertEquals(List.of("React", "Node.js"), keywordGroupService.activeKeywords(1L));
    }

    @Test
    @DisplayName("replace twice -> only the newest group is active")
    void replace_deactivates_previous() {
        //Arrange
        keywordGroupService.replaceActiveGroup(1L, List.of("java"));
        //Act
        keywordGroupService.replaceActiveGroup(1L, List.of("kotlin", "scala"));
        //Assert
        assertEquals(1, repository.findByUserIdAndActiveTrue(1L).size());
        assertEquals(List.of("kotlin", "scala"), keywordGroupService.activeKeywords(1L));
        assertEquals(2, repository.count());
    }

    @Test
    @DisplayName("groups are per user")
    void groups_are_user_scoped() {
        //Arrange
        keywordGroupService.replaceActiveGroup(1L, List.of("java"));
        keywordGroupService.replaceActiveGroup(2L, List.of("python"));
        //Act + Assert
        assertEquals(List.of("java"), keywordGroupService.activeKeywords(1L));
        assertEquals(List.of("python"), keywordGroupService.activeKeywords(2L));
        assertTrue(keywordGroupService.activeKeywords(3L).isEmpty());
    }

    @Test
    @DisplayName("too short, too long, null or empty -> InvalidKeywordException")
    void invalid_keywords_rejected() {
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.validate(List.of("a")));
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.validate(List.of("x".repeat(51))));
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.validate(List.of()));
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.validate(null));
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.validate(Arrays.asList("ok", null)));
    }

    @Test
    @DisplayName("length bounds are inclusive")
    void bounds_inclusive() {
        List<String> cleaned = keywordGroupService.validate(List.of("go", "y".repeat(50)));
        assertEquals(2, cleaned.size());
    }

    @Test
    @DisplayName("invalid replace -> previous group stays active")
    void invalid_replace_keeps_previous() {
        //Arrange
        keywordGroupService.replaceActiveGroup(1L, List.of("java"));
        //Act
        assertThrows(InvalidKeywordException.class, () -> keywordGroupService.replaceActiveGroup(1L, List.of("j")));
        //Assert
        assertEquals(List.of("java"), keywordGroupService.activeKeywords(1L));
    }
}
