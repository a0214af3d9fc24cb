package com.mike.leadscout.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One scheduler tick for one channel. Stored on start, finalized on end,
 * kept for failed runs too.
 */
@Entity
@Table(name = "scrape_runs",
        indexes = @Index(name = "idx_scrape_runs_channel_started", columnList = "channel_id, started_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class ScrapeRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(name = "platform_connection_id")
    private Long platformConnectionId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    // null while the run is in flight
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private RunOutcome outcome;

    @Column(name = "error_detail", length = 2000)
    private String errorDetail;

    @Column(name = "posts_found", nullable = false)
    private int postsFound;

    @Column(name = "leads_created", nullable = false)
    private int leadsCreated;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "config_version", length = 100)
    private String configVersion;

    @Column(name = "config_source", length = 30)
    private String configSource;

    public boolean isSuccess() {
        return outcome == RunOutcome.SUCCESS;
    }
}
