package com.dailycode.domain.common.exception;

public class CatalogUnavailableException extends StoreUnavailableException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String storeName() {
        return "problem catalog";
    }
}
