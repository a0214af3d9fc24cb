package com.mike.leadscout.service.scrape;

import com.mike.leadscout.entity.ConnectionStatus;
import com.mike.leadscout.entity.PlatformConnection;
import com.mike.leadscout.repository.PlatformConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Connection bookkeeping after each run: success clears the last error, failure stores it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlatformConnectionService {

    private final PlatformConnectionRepository repository;
    private final Clock clock;

    @Transactional
    public void markChecked(Long connectionId) {
        repository.findById(connectionId).ifPresent(connection -> {
            connection.setLastCheckedAt(LocalDateTime.now(clock));
            connection.setLastError(null);
            if (connection.getStatus() == ConnectionStatus.ERROR) {
                connection.setStatus(ConnectionStatus.CONNECTED);
            }
            repository.save(connection);
        });
    }

    @Transactional
    public void markError(Long connectionId, String error) {
        repository.findById(connectionId).ifPresent(connection -> {
            if (connection.getStatus() == ConnectionStatus.DISCONNECTED) return;
            connection.setLastError(error);
            connection.setStatus(ConnectionStatus.ERROR);
            repository.save(connection);
            log.info("PlatformConnectionService: connection id={} platform={} marked ERROR", connectionId, connection.getPlatform());
        });
    }

    @Transactional
    public Optional<PlatformConnection> disconnect(Long connectionId) {
        return repository.findById(connectionId).map(connection -> {
            connection.setStatus(ConnectionStatus.DISCONNECTED);
            log.info("PlatformConnectionService: connection id={} platform={} disconnected", connectionId, connection.getPlatform());
            return repository.save(connection);
        });
    }
}
