package com.mike.leadscout.service.lead;

import com.mike.leadscout.entity.Lead;
import com.mike.leadscout.entity.LeadStatus;
import com.mike.leadscout.repository.LeadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class LeadService {

    private final LeadRepository leadRepository;
    private final Clock clock;

    /**
     * One lead per (userId, postId). An existing lead gets the new keywords unioned in;
     * its status is left alone.
     */
    @Transactional
    public LeadUpsertOutcome upsert(Long userId, Long postId, Set<String> matchedKeywords) {
        if (matchedKeywords == null || matchedKeywords.isEmpty()) {
            throw new IllegalArgumentException("a lead needs at least one matched keyword");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Lead> existing = leadRepository.findByUserIdAndPostId(userId, postId);

        if (existing.isPresent()) {
            Lead lead = existing.get();
            if (!lead.getMatchedKeywords().addAll(matchedKeywords)) {
                return LeadUpsertOutcome.UNCHANGED;
            }
            lead.setUpdatedAt(now);
            leadRepository.save(lead);
            log.debug("LeadService: updated lead id={} userId={} postId={} keywords={}",
                    lead.getId(), userId, postId, lead.getMatchedKeywords());
            return LeadUpsertOutcome.UPDATED;
        }

        Lead lead = Lead.builder()
                .userId(userId)
                .postId(postId)
                .matchedKeywords(new LinkedHashSet<>(matchedKeywords))
                .status(LeadStatus.NEW)
                .createdAt(now)
                .updatedAt(now)
                .build();
        leadRepository.save(lead);
        log.debug("LeadService: created lead userId={} postId={} keywords={}", userId, postId, matchedKeywords);
        return LeadUpsertOutcome.CREATED;
    }

    @Transactional(readOnly = true)
    public List<Lead> leadsForUser(Long userId, LeadStatus status) {
        if (status == null) {
            return leadRepository.findByUserIdOrderByCreatedAtDesc(userId);
        }
        return leadRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status);
    }

    /**
     * @return empty when the lead does not exist or belongs to someone else
     */
    @Transactional
    public Optional<Lead> updateStatus(Long userId, Long leadId, LeadStatus status) {
        if (status == null) throw new IllegalArgumentException("status is required");

        return leadRepository.findByIdAndUserId(leadId, userId)
                .map(lead -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    lead.setStatus(status);
                    lead.setUpdatedAt(now);
                    if (status == LeadStatus.VIEWED && lead.getFirstViewedAt() == null) {
                        lead.setFirstViewedAt(now);
                    }
                    log.info("LeadService: lead id={} userId={} status={}", leadId, userId, status);
                    return leadRepository.save(lead);
                });
    }
}
