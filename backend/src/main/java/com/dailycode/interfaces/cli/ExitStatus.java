package com.dailycode.interfaces.cli;

import com.dailycode.domain.common.exception.ConfigurationException;
import com.dailycode.domain.common.exception.StoreUnavailableException;
import org.springframework.boot.context.properties.bind.BindException;

/**
 * Process exit codes of the command-line entry point.
 */
public enum ExitStatus {
    /** Includes runs where individual subscribers failed. */
    OK(0),
    COMMAND_FAILURE(1),
    /** A backing store could not be reached. */
    SYSTEMIC_FAILURE(2),
    CONFIGURATION_ERROR(3),
    USAGE_ERROR(64);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Classifies an exception that escaped command execution or application start-up.
     */
    public static ExitStatus of(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof ConfigurationException || t instanceof BindException) {
                return CONFIGURATION_ERROR;
            }
            if (t instanceof StoreUnavailableException) {
                return SYSTEMIC_FAILURE;
            }
        }
        return COMMAND_FAILURE;
    }
}
