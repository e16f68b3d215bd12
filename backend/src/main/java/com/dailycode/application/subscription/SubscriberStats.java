package com.dailycode.application.subscription;

import com.dailycode.domain.problem.model.Difficulty;

import java.time.Instant;
import java.util.Map;

public record SubscriberStats(
        String email,
        String language,
        String difficulty,
        boolean active,
        Instant subscribedAt,
        long totalDelivered,
        long failedAttempts,
        Map<Difficulty, Long> deliveredByDifficulty,
        Instant lastDeliveredAt
) {}
