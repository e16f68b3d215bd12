package com.dailycode.application.delivery;

public enum EntryOutcome {
    SUCCESS,
    FAILED,
    NO_CONTENT_AVAILABLE,
    /** The run timed out or was cancelled before this subscriber's pipeline started. */
    NOT_ATTEMPTED,
    /** The pipeline was in flight when the run timed out or was cancelled. */
    INTERRUPTED
}
