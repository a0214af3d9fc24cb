package com.mike.leadscout.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "posts",
        indexes = @Index(name = "idx_posts_channel_external", columnList = "channel_id, external_id"))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "channel_id", nullable = false, updatable = false)
    private Long channelId;

    /**
     * Platform-side identifier (permalink, message key) used to skip re-scraped posts.
     */
    @Column(name = "external_id", length = 1000, updatable = false)
    private String externalId;

    @Column(name = "posted_at", nullable = false, updatable = false)
    private LocalDateTime postedAt;

    @Column(nullable = false, length = 20000, updatable = false)
    private String content;

    @Column(name = "source_url", length = 2000, updatable = false)
    private String sourceUrl;

    // JSON
    @Column(length = 10000, updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (postedAt == null) postedAt = createdAt;
        if (metadata == null) metadata = "{}";
    }
}
