package com.dailycode.domain.delivery.model;

/**
 * Why a pipeline stopped.
 *
 * @param stage     stage that failed
 * @param errorType short error classification, usually the exception's simple name
 * @param message   human readable detail
 */
public record StageFailure(PipelineStage stage, String errorType, String message) {

    public static final String INTERRUPTED = "Interrupted";

    public static StageFailure of(PipelineStage stage, Throwable cause) {
        return new StageFailure(stage, cause.getClass().getSimpleName(), cause.getMessage());
    }

    public static StageFailure interrupted(PipelineStage stage) {
        return new StageFailure(stage, INTERRUPTED, "Interrupted before " + stage.label() + " completed");
    }

    public boolean isInterruption() {
        return INTERRUPTED.equals(errorType);
    }

    public String describe() {
        return stage.label() + ": " + errorType + (message == null ? "" : " - " + message);
    }
}
