package com.dailycode.interfaces.api.dto;

import com.dailycode.application.delivery.RunReport;
import com.dailycode.infrastructure.scheduling.TriggerResult;

public record TriggerResponse(
        String status,
        String summary,
        RunReport report
) {
    public static TriggerResponse from(TriggerResult result) {
        return new TriggerResponse(
                result.status().name(),
                result.report() == null ? null : result.report().summary(),
                result.report());
    }
}
