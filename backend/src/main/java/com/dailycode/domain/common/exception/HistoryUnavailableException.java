package com.dailycode.domain.common.exception;

public class HistoryUnavailableException extends StoreUnavailableException {

    public HistoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String storeName() {
        return "delivery history";
    }
}
