package com.mike.leadscout.service.keyword;

public class InvalidKeywordException extends RuntimeException {
    public InvalidKeywordException(String message) {
        super(message);
    }
}
