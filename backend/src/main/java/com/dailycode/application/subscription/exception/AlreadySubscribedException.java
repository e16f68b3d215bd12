package com.dailycode.application.subscription.exception;

public class AlreadySubscribedException extends RuntimeException {
    public AlreadySubscribedException(String email) {
        super(email + " is already subscribed.");
    }
}
