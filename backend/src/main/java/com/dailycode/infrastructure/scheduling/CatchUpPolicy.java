package com.dailycode.infrastructure.scheduling;

/**
 * What the scheduler does about an occurrence that passed while the process was down.
 */
public enum CatchUpPolicy {
    /** Wait for the next future occurrence. */
    SKIP,
    /** Fire one run at start-up if the latest occurrence has no delivery attempt after it. */
    RUN_ONCE
}
