package com.dailycode.domain.subscriber.model;

import com.dailycode.domain.problem.model.Difficulty;

import java.util.Arrays;
import java.util.Optional;

/**
 * A subscriber's difficulty filter. {@link #ANY} matches every difficulty.
 */
public enum DifficultyPreference {
    EASY(Difficulty.EASY),
    MEDIUM(Difficulty.MEDIUM),
    HARD(Difficulty.HARD),
    ANY(null);

    private final Difficulty difficulty;

    DifficultyPreference(Difficulty difficulty) {
        this.difficulty = difficulty;
    }

    public boolean matches(Difficulty candidate) {
        return difficulty == null || difficulty == candidate;
    }

    public static Optional<DifficultyPreference> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
