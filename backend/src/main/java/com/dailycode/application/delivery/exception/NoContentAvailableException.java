package com.dailycode.application.delivery.exception;

public class NoContentAvailableException extends RuntimeException {

    public NoContentAvailableException(String subscriberId) {
        super("No unseen problem matches the preferences of " + subscriberId);
    }
}
