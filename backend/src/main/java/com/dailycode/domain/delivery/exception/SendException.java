package com.dailycode.domain.delivery.exception;

public class SendException extends RuntimeException {

    public SendException(String message) {
        super(message);
    }

    public SendException(String message, Throwable cause) {
        super(message, cause);
    }
}
