package com.dailycode.infrastructure.pipeline;

public enum EmbellishmentFailurePolicy {
    /** Send the solution without commentary and flag the delivery as degraded. */
    DEGRADE,
    /** Treat the failure like any other stage failure. */
    FAIL
}
