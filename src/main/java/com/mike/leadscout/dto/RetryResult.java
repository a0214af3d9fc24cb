package com.mike.leadscout.dto;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a retried operation with its ordered attempt log.
 */
public record RetryResult<T>(boolean success, T value, Exception lastError, List<RetryAttempt> attempts) {

    public RetryResult {
        attempts = List.copyOf(attempts);
    }

    public static <T> RetryResult<T> succeeded(T value, List<RetryAttempt> attempts) {
        return new RetryResult<>(true, value, null, attempts);
    }

    public static <T> RetryResult<T> failed(Exception lastError, List<RetryAttempt> attempts) {
        return new RetryResult<>(false, null, Objects.requireNonNull(lastError, "lastError"), attempts);
    }

    public int attemptCount() {
        return attempts.size();
    }

    public String errorDetail() {
        if (lastError == null) return null;
        String message = lastError.getMessage();
        return message == null || message.isBlank() ? lastError.getClass().getSimpleName() : message;
    }

    public List<Long> backoffsApplied() {
        return attempts.stream()
                .map(RetryAttempt::backoffAppliedMs)
                .filter(Objects::nonNull)
                .toList();
    }
}
