package com.dailycode.domain.delivery.model;

/**
 * Terminal state of one subscriber's pipeline: either sent, possibly degraded, or failed at a stage.
 */
public record PipelineOutcome(boolean sent, StageFailure failure, DegradationWarning degradation) {

    public static PipelineOutcome sent(DegradationWarning degradation) {
        return new PipelineOutcome(true, null, degradation);
    }

    public static PipelineOutcome failed(StageFailure failure) {
        return new PipelineOutcome(false, failure, null);
    }

    public boolean isDegraded() {
        return degradation != null;
    }

    public boolean isInterrupted() {
        return failure != null && failure.isInterruption();
    }
}
