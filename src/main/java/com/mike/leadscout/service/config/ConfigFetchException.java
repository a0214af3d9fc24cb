package com.mike.leadscout.service.config;

/**
 * Remote config could not be read (network, auth, unknown platform, invalid document).
 */
public class ConfigFetchException extends RuntimeException {

    public ConfigFetchException(String message) {
        super(message);
    }

    public ConfigFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
