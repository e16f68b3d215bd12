package com.dailycode.domain.delivery.model;

/**
 * Attached to a delivery that went out without commentary.
 */
public record DegradationWarning(String errorType, String message) {

    public String describe() {
        return "Sent without commentary (" + errorType + (message == null ? "" : ": " + message) + ")";
    }
}
