package com.dailycode.infrastructure.pipeline;

import com.dailycode.domain.delivery.model.StageFailure;

/**
 * Tagged result of one stage transition: a payload for the next stage or the failure that ends the pipeline.
 */
record StageResult<T>(T value, StageFailure failure) {

    static <T> StageResult<T> success(T value) {
        return new StageResult<>(value, null);
    }

    static <T> StageResult<T> failure(StageFailure failure) {
        return new StageResult<>(null, failure);
    }

    boolean isFailure() {
        return failure != null;
    }
}
