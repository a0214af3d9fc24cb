package com.mike.leadscout.service.retry;

import com.mike.leadscout.dto.RetryAttempt;
import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.RetryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Runs a fallible operation up to {@code maxRetries + 1} times. Between failed attempts it
 * waits {@code initialBackoffMs}, then that delay times {@code backoffMultiplier}, and so on.
 * There is no wait after the last attempt and no wall-clock timeout of its own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;
    private final Clock clock;

    public <T> RetryResult<T> run(String operationName, Callable<T> operation, RetryPolicy policy) {
        List<RetryAttempt> attempts = new ArrayList<>(policy.maxAttempts());
        long backoffMs = policy.initialBackoffMs();
        Exception lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                T value = operation.call();
                attempts.add(RetryAttempt.success(attempt, LocalDateTime.now(clock)));
                logSummary(operationName, true, attempts);
                return RetryResult.succeeded(value, attempts);
            } catch (Exception e) {
                lastError = e;
                boolean willRetry = attempt < policy.maxAttempts();
                attempts.add(RetryAttempt.failure(attempt, LocalDateTime.now(clock), describe(e),
                        willRetry ? backoffMs : null));

                if (!willRetry) {
                    log.warn("RetryExecutor: {} attempt {}/{} failed, no retries left: {}",
                            operationName, attempt, policy.maxAttempts(), describe(e));
                    break;
                }

                log.warn("RetryExecutor: {} attempt {}/{} failed: {} -> waiting {}ms",
                        operationName, attempt, policy.maxAttempts(), describe(e), backoffMs);

                try {
                    sleeper.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("RetryExecutor: {} interrupted during backoff, giving up after attempt {}",
                            operationName, attempt);
                    break;
                }
                backoffMs = nextBackoff(backoffMs, policy.backoffMultiplier());
            }
        }

        logSummary(operationName, false, attempts);
        return RetryResult.failed(lastError, attempts);
    }

    static long nextBackoff(long currentMs, double multiplier) {
        double next = currentMs * multiplier;
        if (next >= Long.MAX_VALUE) return Long.MAX_VALUE;
        return Math.round(next);
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private void logSummary(String operationName, boolean success, List<RetryAttempt> attempts) {
        String attemptLog = attempts.stream().map(RetryAttempt::toLogToken).collect(Collectors.joining(","));
        if (success) {
            log.debug("RetryExecutor: {} outcome=SUCCESS attempts={} log=[{}]", operationName, attempts.size(), attemptLog);
        } else {
            log.info("RetryExecutor: {} outcome=FAILURE attempts={} log=[{}]", operationName, attempts.size(), attemptLog);
        }
    }
}
