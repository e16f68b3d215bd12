package com.dailycode.infrastructure.scheduling;

import java.time.ZonedDateTime;

public record SchedulerStatus(
        boolean started,
        boolean runInProgress,
        String cadence,
        String catchUp,
        ZonedDateTime nextFireTime
) {}
