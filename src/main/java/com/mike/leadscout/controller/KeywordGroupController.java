package com.mike.leadscout.controller;

import com.mike.leadscout.dto.KeywordGroupRequest;
import com.mike.leadscout.entity.UserKeywordGroup;
import com.mike.leadscout.service.keyword.InvalidKeywordException;
import com.mike.leadscout.service.keyword.KeywordGroupService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users/{userId}/keyword-groups")
@RequiredArgsConstructor
public class KeywordGroupController {

    private final KeywordGroupService keywordGroupService;

    @GetMapping("/active")
    public ResponseEntity<UserKeywordGroup> active(@PathVariable Long userId) {
        return keywordGroupService.activeGroup(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PutMapping("/active")
    public UserKeywordGroup replaceActive(@PathVariable Long userId, @RequestBody KeywordGroupRequest request) {
        return keywordGroupService.replaceActiveGroup(userId, request == null ? null : request.keywords());
    }

    @ExceptionHandler(InvalidKeywordException.class)
    public ResponseEntity<Map<String, String>> invalidKeyword(InvalidKeywordException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
