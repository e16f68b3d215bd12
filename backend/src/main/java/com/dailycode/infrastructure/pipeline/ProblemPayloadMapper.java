package com.dailycode.infrastructure.pipeline;

import com.dailycode.domain.delivery.model.ProblemExample;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.problem.model.Problem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the raw JSON columns of a {@link Problem} into a {@link ProblemPayload}.
 */
@Component
@RequiredArgsConstructor
public class ProblemPayloadMapper {

    private static final TypeReference<List<Map<String, Object>>> OBJECT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ProblemPayload toPayload(Problem problem) {
        return new ProblemPayload(
                problem.getId(),
                problem.getTitle(),
                problem.getDescription(),
                problem.getDifficulty(),
                problem.getTags(),
                problem.getConstraints() == null ? "" : problem.getConstraints(),
                parseExamples(problem.getId(), problem.getExamples()),
                parseHints(problem.getId(), problem.getHints()),
                parseTestCases(problem.getId(), problem.getTestCases())
        );
    }

    private List<ProblemExample> parseExamples(String problemId, String json) {
        JsonNode root = readArray(problemId, "examples", json);
        List<ProblemExample> examples = new ArrayList<>();
        for (JsonNode node : root) {
            examples.add(new ProblemExample(
                    text(node, "input"),
                    text(node, "output"),
                    text(node, "explanation")));
        }
        return List.copyOf(examples);
    }

    private List<String> parseHints(String problemId, String json) {
        JsonNode root = readArray(problemId, "hints", json);
        List<String> hints = new ArrayList<>();
        root.forEach(node -> hints.add(node.asText()));
        return List.copyOf(hints);
    }

    private List<Map<String, Object>> parseTestCases(String problemId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, OBJECT_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed test_cases for problem " + problemId, e);
        }
    }

    private JsonNode readArray(String problemId, String field, String json) {
        if (json == null || json.isBlank()) {
            return objectMapper.createArrayNode();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isArray()) {
                throw new IllegalArgumentException("Expected a JSON array in " + field + " of problem " + problemId);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + field + " for problem " + problemId, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }
}
