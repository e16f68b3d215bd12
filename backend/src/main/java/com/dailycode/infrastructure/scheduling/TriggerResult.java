package com.dailycode.infrastructure.scheduling;

import com.dailycode.application.delivery.RunReport;
import com.dailycode.application.delivery.TriggerSource;

/**
 * What happened to one trigger. {@code report} is set only when the run completed,
 * {@code error} only when it aborted on a systemic failure.
 */
public record TriggerResult(Status status, TriggerSource source, RunReport report, RuntimeException error) {

    public enum Status {
        COMPLETED,
        /** Another run was in progress. */
        SKIPPED,
        FAILED
    }

    static TriggerResult completed(RunReport report) {
        return new TriggerResult(Status.COMPLETED, report.source(), report, null);
    }

    static TriggerResult skipped(TriggerSource source) {
        return new TriggerResult(Status.SKIPPED, source, null, null);
    }

    static TriggerResult failed(TriggerSource source, RuntimeException error) {
        return new TriggerResult(Status.FAILED, source, null, error);
    }
}
