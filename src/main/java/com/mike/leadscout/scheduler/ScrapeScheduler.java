package com.mike.leadscout.scheduler;

import com.mike.leadscout.config.LeadScoutProperties;
import com.mike.leadscout.dto.ChannelScheduleState;
import com.mike.leadscout.dto.ResolvedConfig;
import com.mike.leadscout.dto.RetryResult;
import com.mike.leadscout.dto.ScrapeCycleResult;
import com.mike.leadscout.entity.Channel;
import com.mike.leadscout.entity.PlatformConnection;
import com.mike.leadscout.entity.ScrapeRun;
import com.mike.leadscout.repository.ChannelRepository;
import com.mike.leadscout.repository.PlatformConnectionRepository;
import com.mike.leadscout.service.config.ConfigResolver;
import com.mike.leadscout.service.retry.RetryExecutor;
import com.mike.leadscout.service.scrape.PlatformConnectionService;
import com.mike.leadscout.service.scrape.ScrapeCycleService;
import com.mike.leadscout.service.scrape.ScrapeRunRecorder;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * One independent fixed-rate timer per channel.
 * <p>
 * The timer thread only claims the channel and hands the run to {@code channelRunExecutor},
 * so it is free again before the next period. A tick resolves the platform config, runs the scrape cycle under the config's retry
 * policy and records a {@link ScrapeRun}. Whatever happens inside the tick is caught here:
 * a failed run is recorded as FAILURE and the timer stays armed. A tick that arrives while
 * the channel's previous run is still active is skipped. Only {@link #stopSchedule(Long)}
 * (directly or through a disconnected platform connection) removes a timer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScrapeScheduler {

    private final TaskScheduler taskScheduler;
    private final ThreadPoolTaskExecutor channelRunExecutor;
    private final ChannelRepository channelRepository;
    private final PlatformConnectionRepository connectionRepository;
    private final PlatformConnectionService connectionService;
    private final ConfigResolver configResolver;
    private final RetryExecutor retryExecutor;
    private final ScrapeCycleService scrapeCycleService;
    private final ScrapeRunRecorder runRecorder;
    private final LeadScoutProperties props;
    private final Clock clock;

    private final ConcurrentMap<Long, ChannelSlot> slots = new ConcurrentHashMap<>();

    /**
     * Arms the channel's timer; the first tick fires immediately.
     *
     * @param intervalMs null or non-positive means the channel's own interval, then the default
     * @return false when the channel was already scheduled
     * @throws IllegalArgumentException for an unknown channel
     */
    public boolean startSchedule(Long channelId, Long intervalMs) {
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new IllegalArgumentException("unknown channel " + channelId));
        long interval = resolveInterval(channel, intervalMs);

        ChannelSlot slot = slots.computeIfAbsent(channelId, ChannelSlot::new);
        synchronized (slot) {
            if (slot.future != null) {
                log.info("ScrapeScheduler: channel={} already scheduled (intervalMs={})", channelId, slot.intervalMs);
                return false;
            }
            slot.intervalMs = interval;
            slot.active = true;
            slot.nextRunAt = LocalDateTime.now(clock);
            slot.future = taskScheduler.scheduleAtFixedRate(() -> tick(slot), clock.instant(), Duration.ofMillis(interval));
        }

        log.info("ScrapeScheduler: channel={} name='{}' scheduled every {}ms", channelId, channel.getName(), interval);
        return true;
    }

    /**
     * Cancels the channel's timer. An in-flight run finishes and is recorded; no tick follows.
     *
     * @return false when nothing was scheduled
     */
    public boolean stopSchedule(Long channelId) {
        ChannelSlot slot = slots.get(channelId);
        if (slot == null) {
            log.debug("ScrapeScheduler: channel={} not scheduled, stop is a no-op", channelId);
            return false;
        }
        synchronized (slot) {
            if (slot.future == null) {
                log.debug("ScrapeScheduler: channel={} not scheduled, stop is a no-op", channelId);
                return false;
            }
            slot.active = false;
            slot.future.cancel(false);
            slot.future = null;
            slot.nextRunAt = null;
        }
        log.info("ScrapeScheduler: channel={} schedule stopped{}", channelId,
                slot.running.get() ? " (run in flight will complete)" : "");
        return true;
    }

    /**
     * Stops every channel of a platform connection.
     *
     * @return number of timers actually cancelled
     */
    public int stopPlatformConnection(Long platformConnectionId) {
        int stopped = 0;
        for (Channel channel : channelRepository.findByPlatformConnectionId(platformConnectionId)) {
            if (stopSchedule(channel.getId())) stopped++;
        }
        log.info("ScrapeScheduler: platformConnection={} stopped {} channel timers", platformConnectionId, stopped);
        return stopped;
    }

    /**
     * Runs one tick on the caller's thread, with the same overlap guard as the timer.
     *
     * @return empty when skipped because a run is active
     * @throws IllegalArgumentException for an unknown channel
     */
    public Optional<ScrapeRun> runNow(Long channelId) {
        if (!channelRepository.existsById(channelId)) {
            throw new IllegalArgumentException("unknown channel " + channelId);
        }
        ChannelSlot slot = slots.computeIfAbsent(channelId, ChannelSlot::new);
        if (!tryClaim(slot)) return Optional.empty();
        return runClaimed(slot);
    }

    public boolean isScheduled(Long channelId) {
        ChannelSlot slot = slots.get(channelId);
        return slot != null && slot.future != null;
    }

    public Set<Long> scheduledChannelIds() {
        return slots.values().stream()
                .filter(slot -> slot.future != null)
                .map(slot -> slot.channelId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public ChannelScheduleState state(Long channelId) {
        ChannelSlot slot = slots.get(channelId);
        if (slot == null) {
            return new ChannelScheduleState(channelId, false, false, null, null, null, null, null, 0);
        }
        ScrapeRun last = slot.lastRun;
        return new ChannelScheduleState(
                channelId,
                slot.future != null,
                slot.running.get(),
                slot.future != null ? slot.intervalMs : null,
                last != null ? last.getStartedAt() : null,
                last != null ? last.getOutcome() : null,
                last != null ? last.getErrorDetail() : null,
                slot.nextRunAt,
                slot.skippedTicks.get());
    }

    @PreDestroy
    public void shutdown() {
        List<Long> ids = List.copyOf(scheduledChannelIds());
        ids.forEach(this::stopSchedule);
        log.info("ScrapeScheduler: shutdown, cancelled {} channel timers", ids.size());
    }

    private void tick(ChannelSlot slot) {
        // cancellation is cooperative: a tick already queued when stop happened does nothing
        if (!slot.active) {
            log.debug("ScrapeScheduler: channel={} tick after stop ignored", slot.channelId);
            return;
        }
        if (!tryClaim(slot)) return;

        try {
            channelRunExecutor.execute(() -> runClaimed(slot));
        } catch (TaskRejectedException e) {
            slot.running.set(false);
            long skipped = slot.skippedTicks.incrementAndGet();
            log.warn("ScrapeScheduler: channel={} run rejected by executor, skipping tick (skippedTicks={}): {}",
                    slot.channelId, skipped, e.getMessage());
        }
    }

    private boolean tryClaim(ChannelSlot slot) {
        if (slot.running.compareAndSet(false, true)) return true;
        long skipped = slot.skippedTicks.incrementAndGet();
        log.info("ScrapeScheduler: channel={} previous run still active, skipping tick (skippedTicks={})",
                slot.channelId, skipped);
        return false;
    }

    /**
     * Caller must hold the slot's running flag; it is released here.
     */
    private Optional<ScrapeRun> runClaimed(ChannelSlot slot) {
        ScrapeRun run = null;
        try {
            run = runOnce(slot.channelId);
            if (run != null) slot.lastRun = run;
            return Optional.ofNullable(run);
        } finally {
            slot.running.set(false);
            if (slot.active) {
                slot.nextRunAt = LocalDateTime.now(clock).plus(Duration.ofMillis(slot.intervalMs));
            }
            if (run != null) {
                updateChannelTimestamps(slot, run);
            }
        }
    }

    /**
     * The failure boundary: never throws.
     */
    private ScrapeRun runOnce(Long channelId) {
        ScrapeRun run = null;
        ResolvedConfig resolved = null;
        try {
            Optional<Channel> maybeChannel = channelRepository.findById(channelId);
            if (maybeChannel.isEmpty()) {
                log.warn("ScrapeScheduler: channel={} no longer exists, tick skipped", channelId);
                return null;
            }
            Channel channel = maybeChannel.get();
            run = runRecorder.start(channel);

            PlatformConnection connection = connectionRepository.findById(channel.getPlatformConnectionId())
                    .orElseThrow(() -> new IllegalStateException(
                            "platform connection " + channel.getPlatformConnectionId() + " not found"));

            resolved = configResolver.resolve(connection.getPlatform());
            ResolvedConfig config = resolved;

            RetryResult<ScrapeCycleResult> result = retryExecutor.run(
                    "scrape channel=" + channelId,
                    () -> scrapeCycleService.runCycle(channel, connection, config.config()),
                    config.config().retryPolicy());

            if (result.success()) {
                run = runRecorder.finishSuccess(run, resolved, result.value(), result.attemptCount());
                updateConnection(connection.getId(), null);
            } else {
                run = runRecorder.finishFailure(run, resolved, result.errorDetail(), result.attemptCount());
                updateConnection(connection.getId(), result.errorDetail());
                log.warn("ScrapeScheduler: channel={} run failed after {} attempts, next tick stays scheduled: {}",
                        channelId, result.attemptCount(), result.errorDetail());
            }
            return run;
        } catch (Exception e) {
            log.error("ScrapeScheduler: channel={} run aborted, next tick stays scheduled", channelId, e);
            if (run == null) return null;
            try {
                return runRecorder.finishFailure(run, resolved, describe(e), run.getAttempts());
            } catch (RuntimeException recordError) {
                log.error("ScrapeScheduler: channel={} could not record failed run", channelId, recordError);
                return run;
            }
        }
    }

    private void updateConnection(Long connectionId, String error) {
        try {
            if (error == null) connectionService.markChecked(connectionId);
            else connectionService.markError(connectionId, error);
        } catch (RuntimeException e) {
            log.warn("ScrapeScheduler: could not update platform connection id={}: {}", connectionId, e.getMessage());
        }
    }

    private void updateChannelTimestamps(ChannelSlot slot, ScrapeRun run) {
        try {
            channelRepository.findById(slot.channelId).ifPresent(channel -> {
                channel.setLastRunAt(run.getStartedAt());
                channel.setNextRunAt(slot.active ? slot.nextRunAt : null);
                channelRepository.save(channel);
            });
        } catch (RuntimeException e) {
            log.warn("ScrapeScheduler: could not update run timestamps for channel={}: {}", slot.channelId, e.getMessage());
        }
    }

    private long resolveInterval(Channel channel, Long requestedMs) {
        if (requestedMs != null && requestedMs > 0) return requestedMs;
        if (channel.getScrapeIntervalMs() != null && channel.getScrapeIntervalMs() > 0) return channel.getScrapeIntervalMs();
        return props.getScheduler().getDefaultIntervalMs();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static final class ChannelSlot {
        final Long channelId;
        final AtomicBoolean running = new AtomicBoolean(false);
        final AtomicLong skippedTicks = new AtomicLong();
        volatile ScheduledFuture<?> future;
        volatile boolean active;
        volatile long intervalMs;
        volatile ScrapeRun lastRun;
        volatile LocalDateTime nextRunAt;

        ChannelSlot(Long channelId) {
            this.channelId = channelId;
        }
    }
}
