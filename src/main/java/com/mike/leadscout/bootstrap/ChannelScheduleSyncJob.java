package com.mike.leadscout.bootstrap;

import com.mike.leadscout.entity.Channel;
import com.mike.leadscout.entity.ConnectionStatus;
import com.mike.leadscout.entity.PlatformConnection;
import com.mike.leadscout.repository.ChannelRepository;
import com.mike.leadscout.repository.PlatformConnectionRepository;
import com.mike.leadscout.scheduler.ScrapeScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps channel timers in line with the database: arms channels of live connections
 * (CONNECTED or ERROR) and stops channels whose connection was disconnected or removed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelScheduleSyncJob {

    private final PlatformConnectionRepository connectionRepository;
    private final ChannelRepository channelRepository;
    private final ScrapeScheduler scrapeScheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Value("${leadscout.scheduler.sync-enabled:true}")
    private boolean syncEnabled;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("ChannelScheduleSync: application ready, arming channel timers");
        sync();
    }

    @Scheduled(initialDelayString = "${leadscout.scheduler.sync-interval-millis:60000}",
            fixedDelayString = "${leadscout.scheduler.sync-interval-millis:60000}")
    public void sync() {
        if (!syncEnabled) {
            log.debug("ChannelScheduleSync: disabled via leadscout.scheduler.sync-enabled=false");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("ChannelScheduleSync: already running, skipping");
            return;
        }
        try {
            doSync();
        } catch (Exception e) {
            log.error("ChannelScheduleSync: sync failed", e);
        } finally {
            running.set(false);
        }
    }

    private void doSync() {
        List<PlatformConnection> live = new ArrayList<>(connectionRepository.findByStatus(ConnectionStatus.CONNECTED));
        live.addAll(connectionRepository.findByStatus(ConnectionStatus.ERROR));

        Set<Long> wanted = new HashSet<>();
        int started = 0;
        for (PlatformConnection connection : live) {
            for (Channel channel : channelRepository.findByPlatformConnectionId(connection.getId())) {
                wanted.add(channel.getId());
                if (!scrapeScheduler.isScheduled(channel.getId())) {
                    try {
                        if (scrapeScheduler.startSchedule(channel.getId(), null)) started++;
                    } catch (IllegalArgumentException e) {
                        log.warn("ChannelScheduleSync: channel={} vanished before scheduling", channel.getId());
                    }
                }
            }
        }

        int stopped = 0;
        for (Long channelId : scrapeScheduler.scheduledChannelIds()) {
            if (!wanted.contains(channelId) && scrapeScheduler.stopSchedule(channelId)) {
                stopped++;
            }
        }

        log.info("ChannelScheduleSync: liveConnections={} channels={} started={} stopped={}",
                live.size(), wanted.size(), started, stopped);
    }
}
