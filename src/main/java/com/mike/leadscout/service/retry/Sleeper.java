package com.mike.leadscout.service.retry;

/**
 * Backoff wait. Runs on the caller's thread, so only that channel's run is delayed.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
}
