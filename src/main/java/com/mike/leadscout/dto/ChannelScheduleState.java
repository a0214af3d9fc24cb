package com.mike.leadscout.dto;

import com.mike.leadscout.entity.RunOutcome;

import java.time.LocalDateTime;

public record ChannelScheduleState(
        Long channelId,
        boolean scheduled,
        boolean running,
        Long intervalMs,
        LocalDateTime lastRunStartedAt,
        RunOutcome lastOutcome,
        String lastError,
        LocalDateTime nextRunAt,
        long skippedTicks
) {}
