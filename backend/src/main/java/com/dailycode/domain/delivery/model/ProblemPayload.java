package com.dailycode.domain.delivery.model;

import com.dailycode.domain.problem.model.Difficulty;

import java.util.List;
import java.util.Map;

/**
 * Stage-neutral view of a problem produced by the fetch stage.
 * Test cases are passed through as parsed JSON objects without interpretation.
 */
public record ProblemPayload(
        String id,
        String title,
        String description,
        Difficulty difficulty,
        List<String> tags,
        String constraints,
        List<ProblemExample> examples,
        List<String> hints,
        List<Map<String, Object>> testCases
) {}
