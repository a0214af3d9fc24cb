package com.mike.leadscout.service.scrape;

/**
 * Opaque failure from the browser layer, timeouts included. Always retryable.
 */
public class ScrapeExecutionException extends RuntimeException {
    public ScrapeExecutionException(String message) {
        super(message);
    }

    public ScrapeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
