package com.mike.leadscout.service.keyword;

/**
 * Post content that cannot be searched. Treated as zero matches.
 */
public class MatchingException extends RuntimeException {
    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
