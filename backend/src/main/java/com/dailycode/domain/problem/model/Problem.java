package com.dailycode.domain.problem.model;

import com.dailycode.infrastructure.persistence.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A catalog entry. Examples, hints and test cases are kept as the raw JSON
 * they were imported with and only parsed when a delivery is prepared.
 */
@Entity
@Table(name = "problems")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Problem {

    @Id
    @Column(length = 120)
    private String id;

    @Column(nullable = false)
    private String title;

    @Lob
    @Column(nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Difficulty difficulty;

    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> tags;

    @Lob
    private String constraints;

    @Lob
    private String examples;

    @Lob
    private String hints;

    @Lob
    private String testCases;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Builder
    public Problem(String id, String title, String description, Difficulty difficulty, List<String> tags,
                   String constraints, String examples, String hints, String testCases, Instant createdAt) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.difficulty = difficulty;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.constraints = constraints;
        this.examples = examples;
        this.hints = hints;
        this.testCases = testCases;
        this.createdAt = createdAt;
    }
}
