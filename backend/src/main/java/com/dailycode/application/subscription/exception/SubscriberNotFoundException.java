package com.dailycode.application.subscription.exception;

public class SubscriberNotFoundException extends RuntimeException {
    public SubscriberNotFoundException(String email) {
        super("No subscription found for " + email + ".");
    }
}
