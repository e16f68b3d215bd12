package com.dailycode.domain.subscriber.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Programming languages a solution can be generated in.
 */
public enum Language {
    PYTHON("python", "Python", "#"),
    JAVA("java", "Java", "//"),
    CPP("cpp", "C++", "//"),
    JAVASCRIPT("javascript", "JavaScript", "//"),
    GO("go", "Go", "//"),
    RUST("rust", "Rust", "//");

    private final String code;
    private final String displayName;
    private final String commentPrefix;

    Language(String code, String displayName, String commentPrefix) {
        this.code = code;
        this.displayName = displayName;
        this.commentPrefix = commentPrefix;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public String commentPrefix() {
        return commentPrefix;
    }

    public static Optional<Language> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(normalized) || l.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
