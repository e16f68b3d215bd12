package com.dailycode.domain.common.exception;

/**
 * A backing store could not be reached. Fatal to the current delivery run.
 */
public abstract class StoreUnavailableException extends RuntimeException {

    protected StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short name of the store, used in logs and health output.
     */
    public abstract String storeName();
}
