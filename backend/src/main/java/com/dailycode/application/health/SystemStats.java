package com.dailycode.application.health;

import com.dailycode.domain.problem.model.Difficulty;

import java.util.List;
import java.util.Map;

public record SystemStats(
        long activeSubscribers,
        long totalProblems,
        Map<Difficulty, Long> problemsByDifficulty,
        long deliveryAttempts,
        List<String> supportedLanguages,
        List<String> supportedDifficulties
) {}
