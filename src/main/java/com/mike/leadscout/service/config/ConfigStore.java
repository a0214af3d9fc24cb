package com.mike.leadscout.service.config;

import com.mike.leadscout.dto.ScraperConfig;
import com.mike.leadscout.entity.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Last known good config per platform, for the lifetime of the process.
 * Reads for one platform run concurrently; a write is exclusive for that platform only.
 */
@Component
@Slf4j
public class ConfigStore {

    private final Map<Platform, ReadWriteLock> locks = new EnumMap<>(Platform.class);
    private final Map<Platform, StoredConfig> entries = new ConcurrentHashMap<>();

    public ConfigStore() {
        for (Platform platform : Platform.values()) {
            locks.put(platform, new ReentrantReadWriteLock());
        }
    }

    public void storeLastKnownGood(ScraperConfig config, LocalDateTime fetchedAt) {
        Platform platform = config.platform();
        ReadWriteLock lock = locks.get(platform);
        lock.writeLock().lock();
        try {
            entries.put(platform, new StoredConfig(config, fetchedAt));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("ConfigStore: stored last known good platform={} version={} fetchedAt={}",
                platform, config.version(), fetchedAt);
    }

    public Optional<StoredConfig> lastKnownGood(Platform platform) {
        ReadWriteLock lock = locks.get(platform);
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(platform));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ScraperConfig defaultFallback(Platform platform) {
        return DefaultScraperConfig.forPlatform(platform);
    }

    public void clear(Platform platform) {
        ReadWriteLock lock = locks.get(platform);
        lock.writeLock().lock();
        try {
            entries.remove(platform);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("ConfigStore: cleared last known good for platform={}", platform);
    }

    public void clearAll() {
        for (Platform platform : Platform.values()) {
            clear(platform);
        }
    }

    public record StoredConfig(ScraperConfig config, LocalDateTime fetchedAt) {}
}
