package com.mike.leadscout.repository;

import com.mike.leadscout.entity.Channel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChannelRepository extends JpaRepository<Channel, Long> {
    List<Channel> findByPlatformConnectionId(Long platformConnectionId);
}
