package com.mike.leadscout.repository;

import com.mike.leadscout.entity.Lead;
import com.mike.leadscout.entity.LeadStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface LeadRepository extends JpaRepository<Lead, Long> {
    Optional<Lead> findByUserIdAndPostId(Long userId, Long postId);
    Optional<Lead> findByIdAndUserId(Long id, Long userId);
    long countByUserIdAndPostId(Long userId, Long postId);
    List<Lead> findByUserIdOrderByCreatedAtDesc(Long userId);
    List<Lead> findByUserIdAndStatusOrderByCreatedAtDesc(Long userId, LeadStatus status);
}
