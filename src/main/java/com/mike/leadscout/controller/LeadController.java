package com.mike.leadscout.controller;

import com.mike.leadscout.dto.LeadStatusRequest;
import com.mike.leadscout.entity.Lead;
import com.mike.leadscout.entity.LeadStatus;
import com.mike.leadscout.service.lead.LeadService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users/{userId}/leads")
@RequiredArgsConstructor
public class LeadController {

    private final LeadService leadService;

    @GetMapping
    public List<Lead> leads(@PathVariable Long userId, @RequestParam(required = false) LeadStatus status) {
        return leadService.leadsForUser(userId, status);
    }

    @PatchMapping("/{leadId}/status")
    public ResponseEntity<?> updateStatus(
            @PathVariable Long userId,
            @PathVariable Long leadId,
            @RequestBody LeadStatusRequest request
    ) {
        if (request == null || request.status() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }
        return leadService.updateStatus(userId, leadId, request.status())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
