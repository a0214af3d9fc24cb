package com.mike.leadscout.repository;

import com.mike.leadscout.entity.ConnectionStatus;
import com.mike.leadscout.entity.PlatformConnection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlatformConnectionRepository extends JpaRepository<PlatformConnection, Long> {
    List<PlatformConnection> findByStatus(ConnectionStatus status);
}
