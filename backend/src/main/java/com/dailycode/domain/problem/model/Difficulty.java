package com.dailycode.domain.problem.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Difficulty {
    EASY,
    MEDIUM,
    HARD;

    public String label() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }

    public static Optional<Difficulty> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(code.trim()))
                .findFirst();
    }
}
