package com.dailycode.domain.common.exception;

/**
 * Missing or invalid configuration detected at start-up.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
