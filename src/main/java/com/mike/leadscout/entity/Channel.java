package com.mike.leadscout.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "channels")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Channel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "platform_connection_id", nullable = false)
    private Long platformConnectionId;

    @Column(nullable = false)
    private String name;

    /**
     * Page the browser opens for this channel (workspace search, feed search).
     */
    @Column(name = "search_url", length = 2000)
    private String searchUrl;

    /**
     * Null means the scheduler default.
     */
    @Column(name = "scrape_interval_ms")
    private Long scrapeIntervalMs;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "next_run_at")
    private LocalDateTime nextRunAt;
}
