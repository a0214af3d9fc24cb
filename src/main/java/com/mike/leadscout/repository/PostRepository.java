package com.mike.leadscout.repository;

import com.mike.leadscout.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PostRepository extends JpaRepository<Post, Long> {
    Optional<Post> findFirstByChannelIdAndExternalId(Long channelId, String externalId);
}
