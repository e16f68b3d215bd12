package com.dailycode.application.subscription.exception;

public class InvalidPreferenceException extends RuntimeException {
    public InvalidPreferenceException(String message) {
        super(message);
    }
}
