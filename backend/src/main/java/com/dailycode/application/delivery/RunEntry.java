package com.dailycode.application.delivery;

import com.dailycode.domain.delivery.model.DegradationWarning;
import com.dailycode.domain.delivery.model.PipelineStage;
import com.dailycode.domain.delivery.model.StageFailure;

/**
 * Per-subscriber line of a {@link RunReport}.
 *
 * @param problemId   selected problem, or null when nothing was selected
 * @param failedStage stage that stopped the pipeline, if any
 * @param warning     degradation detail when the message went out without commentary
 */
public record RunEntry(
        String subscriberId,
        String problemId,
        EntryOutcome outcome,
        PipelineStage failedStage,
        String error,
        boolean degraded,
        String warning
) {

    public static RunEntry success(String subscriberId, String problemId, DegradationWarning degradation) {
        return new RunEntry(subscriberId, problemId, EntryOutcome.SUCCESS, null, null,
                degradation != null, degradation == null ? null : degradation.describe());
    }

    public static RunEntry failed(String subscriberId, String problemId, StageFailure failure) {
        EntryOutcome outcome = failure.isInterruption() ? EntryOutcome.INTERRUPTED : EntryOutcome.FAILED;
        return new RunEntry(subscriberId, problemId, outcome, failure.stage(), failure.describe(), false, null);
    }

    public static RunEntry failed(String subscriberId, String problemId, String error) {
        return new RunEntry(subscriberId, problemId, EntryOutcome.FAILED, null, error, false, null);
    }

    public static RunEntry noContent(String subscriberId) {
        return new RunEntry(subscriberId, null, EntryOutcome.NO_CONTENT_AVAILABLE, null, null, false, null);
    }

    public static RunEntry notAttempted(String subscriberId) {
        return new RunEntry(subscriberId, null, EntryOutcome.NOT_ATTEMPTED, null, null, false, null);
    }

    public static RunEntry interrupted(String subscriberId, String problemId) {
        return new RunEntry(subscriberId, problemId, EntryOutcome.INTERRUPTED, null,
                "Interrupted while in flight", false, null);
    }
}
