package com.mike.leadscout.repository;

import com.mike.leadscout.entity.UserKeywordGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserKeywordGroupRepository extends JpaRepository<UserKeywordGroup, Long> {
    Optional<UserKeywordGroup> findFirstByUserIdAndActiveTrueOrderByUpdatedAtDesc(Long userId);
    List<UserKeywordGroup> findByUserIdAndActiveTrue(Long userId);
}
