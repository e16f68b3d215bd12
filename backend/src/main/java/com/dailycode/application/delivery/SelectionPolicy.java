package com.dailycode.application.delivery;

/**
 * Tie-break among a subscriber's remaining candidate problems.
 */
public enum SelectionPolicy {
    /** Lowest problem identity first. */
    LOWEST_ID,
    /** Pseudo-random pick seeded by subscriber identity and delivery date. */
    RANDOM
}
