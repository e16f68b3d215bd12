package com.dailycode.domain.delivery.exception;

/**
 * The text-generation collaborator failed or returned an unusable response.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
