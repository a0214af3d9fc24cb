package com.mike.leadscout.service.retry;

import com.mike.leadscout.dto.RetryPolicy;
import com.mike.leadscout.dto.RetryResult;
import com.mike.leadscout.entity.RunOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private List<Long> sleeps;
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        Sleeper recordingSleeper = sleeps::add;
        retryExecutor = new RetryExecutor(recordingSleeper,
                Clock.fixed(Instant.parse("2026-01-10T10:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        @DisplayName("always failing -> maxRetries + 1 attempts, no more")
        void always_failing_stops_after_max_attempts() {
            //Arrange
            AtomicInteger calls = new AtomicInteger();
            RetryPolicy policy = new RetryPolicy(3, 100, 2.0);
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> {
                calls.incrementAndGet();
                throw new IllegalStateException("Network error: ECONNREFUSED");
            }, policy);
            //Assert
            assertFalse(result.success());
            assertEquals(4, calls.get());
            assertEquals(4, result.attemptCount());
            assertEquals("Network error: ECONNREFUSED", result.errorDetail());
        }

        @Test
        @DisplayName("backoffs grow by the multiplier and none follows the last attempt")
        void backoffs_grow_exponentially() {
            //Arrange
            RetryPolicy policy = new RetryPolicy(3, 100, 2.0);
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> {
                throw new RuntimeException("boom");
            }, policy);
            //Assert
            assertEquals(List.of(100L, 200L, 400L), sleeps);
            assertEquals(List.of(100L, 200L, 400L), result.backoffsApplied());
            assertNull(result.attempts().get(3).backoffAppliedMs());
        }

        @Test
        @DisplayName("success on third attempt -> success, log of 3 with 2 failures")
        void success_after_two_failures() {
            //Arrange
            AtomicInteger calls = new AtomicInteger();
            RetryPolicy policy = new RetryPolicy(3, 50, 3.0);
            //Act
            RetryResult<Integer> result = retryExecutor.run("test", () -> {
                if (calls.incrementAndGet() < 3) throw new RuntimeException("Timeout: page load");
                return 42;
            }, policy);
            //Assert
            assertTrue(result.success());
            assertEquals(42, result.value());
            assertEquals(3, result.attemptCount());
            assertEquals(RunOutcome.FAILURE, result.attempts().get(0).outcome());
            assertEquals(RunOutcome.FAILURE, result.attempts().get(1).outcome());
            assertEquals(RunOutcome.SUCCESS, result.attempts().get(2).outcome());
            assertEquals(List.of(50L, 150L), sleeps);
            assertNull(result.lastError());
        }

        @Test
        @DisplayName("first attempt succeeds -> no sleep")
        void immediate_success_does_not_sleep() {
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> "ok", RetryPolicy.defaults());
            //Assert
            assertTrue(result.success());
            assertEquals(1, result.attemptCount());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("maxRetries 0 -> exactly one attempt")
        void zero_retries_means_single_attempt() {
            //Arrange
            AtomicInteger calls = new AtomicInteger();
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> {
                calls.incrementAndGet();
                throw new RuntimeException("fail");
            }, new RetryPolicy(0, 1000, 2.0));
            //Assert
            assertEquals(1, calls.get());
            assertEquals(1, result.attemptCount());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("attempt numbers are 1-based and ordered")
        void attempt_numbers_are_ordered() {
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> {
                throw new RuntimeException("fail");
            }, new RetryPolicy(2, 10, 2.0));
            //Assert
            assertEquals(List.of(1, 2, 3), result.attempts().stream().map(a -> a.attemptNumber()).toList());
            assertEquals("1:FAILURE(backoff=10ms)", result.attempts().get(0).toLogToken());
        }

        @Test
        @DisplayName("exception without message -> class name as error detail")
        void blank_message_uses_class_name() {
            //Act
            RetryResult<String> result = retryExecutor.run("test", () -> {
                throw new IllegalStateException();
            }, new RetryPolicy(0, 0, 1.0));
            //Assert
            assertEquals("IllegalStateException", result.errorDetail());
            assertEquals("IllegalStateException", result.attempts().get(0).errorDetail());
        }

        @Test
        @DisplayName("interrupted during backoff -> gives up and keeps interrupt flag")
        void interrupt_during_backoff_stops_retrying() {
            //Arrange
            RetryExecutor interrupted = new RetryExecutor(ms -> {
                throw new InterruptedException();
            }, Clock.systemUTC());
            AtomicInteger calls = new AtomicInteger();
            //Act
            RetryResult<String> result = interrupted.run("test", () -> {
                calls.incrementAndGet();
                throw new RuntimeException("fail");
            }, new RetryPolicy(3, 10, 2.0));
            //Assert
            assertFalse(result.success());
            assertEquals(1, calls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        }
    }

    @Nested
    @DisplayName("nextBackoff")
    class NextBackoff {

        @Test
        @DisplayName("multiplier 1 -> constant delay")
        void multiplier_one_keeps_delay() {
            assertEquals(500L, RetryExecutor.nextBackoff(500, 1.0));
        }

        @Test
        @DisplayName("overflow -> capped at Long.MAX_VALUE")
        void overflow_is_capped() {
            assertEquals(Long.MAX_VALUE, RetryExecutor.nextBackoff(Long.MAX_VALUE / 2, 4.0));
        }
    }

    @Nested
    @DisplayName("RetryPolicy")
    class Policy {

        @Test
        @DisplayName("negative maxRetries -> rejected")
        void negative_retries_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 100, 2.0));
        }

        @Test
        @DisplayName("multiplier below 1 -> rejected")
        void shrinking_multiplier_rejected() {
            assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 100, 0.5));
        }

        @Test
        @DisplayName("defaults -> 3 retries, 1000ms, x2")
        void defaults() {
            RetryPolicy policy = RetryPolicy.defaults();
            assertEquals(3, policy.maxRetries());
            assertEquals(1000L, policy.initialBackoffMs());
            assertEquals(2.0, policy.backoffMultiplier());
            assertEquals(4, policy.maxAttempts());
        }
    }
}
