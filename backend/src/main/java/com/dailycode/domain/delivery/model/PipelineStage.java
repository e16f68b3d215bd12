package com.dailycode.domain.delivery.model;

import java.util.Locale;

/**
 * Ordered content-production stages. A pipeline never skips or reorders them.
 */
public enum PipelineStage {
    FETCH,
    SOLVE,
    EMBELLISH,
    SEND;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
