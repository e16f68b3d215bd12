package com.dailycode.domain.common.exception;

public class DirectoryUnavailableException extends StoreUnavailableException {

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String storeName() {
        return "subscriber directory";
    }
}
