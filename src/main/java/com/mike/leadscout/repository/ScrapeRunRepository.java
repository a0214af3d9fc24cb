package com.mike.leadscout.repository;

import com.mike.leadscout.entity.ScrapeRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScrapeRunRepository extends JpaRepository<ScrapeRun, Long> {
    List<ScrapeRun> findByChannelIdOrderByStartedAtDesc(Long channelId, Pageable pageable);
}
