package com.mike.leadscout.dto;

import com.mike.leadscout.entity.RunOutcome;

import java.time.LocalDateTime;

/**
 * One entry of a retry attempt log.
 *
 * @param backoffAppliedMs wait before the next attempt; null when no retry followed
 */
public record RetryAttempt(
        int attemptNumber,
        LocalDateTime timestamp,
        RunOutcome outcome,
        String errorDetail,
        Long backoffAppliedMs
) {

    public static RetryAttempt success(int attemptNumber, LocalDateTime timestamp) {
        return new RetryAttempt(attemptNumber, timestamp, RunOutcome.SUCCESS, null, null);
    }

    public static RetryAttempt failure(int attemptNumber, LocalDateTime timestamp, String errorDetail, Long backoffAppliedMs) {
        return new RetryAttempt(attemptNumber, timestamp, RunOutcome.FAILURE, errorDetail, backoffAppliedMs);
    }

    public String toLogToken() {
        StringBuilder sb = new StringBuilder().append(attemptNumber).append(':').append(outcome);
        if (backoffAppliedMs != null) sb.append("(backoff=").append(backoffAppliedMs).append("ms)");
        return sb.toString();
    }
}
