package com.dailycode.support;

import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;

import java.time.Instant;
import java.util.List;

public final class Fixtures {

    public static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static Subscriber subscriber(String email, Language language, DifficultyPreference difficulty) {
        return Subscriber.builder()
                .id(email)
                .language(language)
                .difficulty(difficulty)
                .createdAt(CREATED)
                .build();
    }

    public static Subscriber subscriber(String email, DifficultyPreference difficulty) {
        return subscriber(email, Language.PYTHON, difficulty);
    }

    public static Problem problem(String id, Difficulty difficulty) {
        return Problem.builder()
                .id(id)
                .title(titleOf(id))
                .description("Description of " + id)
                .difficulty(difficulty)
                .tags(List.of("array"))
                .constraints("1 <= n <= 10^4")
                .examples("[{\"input\":\"nums = [2,7]\",\"output\":\"[0,1]\",\"explanation\":\"2 + 7 = 9\"}]")
                .hints("[\"Use a map\",\"Think about complements\",\"Third hint\"]")
                .testCases("[{\"input\":\"[2,7]\",\"output\":\"[0,1]\"}]")
                .createdAt(CREATED)
                .build();
    }

    private static String titleOf(String id) {
        StringBuilder sb = new StringBuilder();
        for (String word : id.split("-")) {
            if (!word.isEmpty()) {
                sb.append(sb.length() == 0 ? "" : " ")
                        .append(Character.toUpperCase(word.charAt(0)))
                        .append(word.substring(1));
            }
        }
        return sb.toString();
    }
}
