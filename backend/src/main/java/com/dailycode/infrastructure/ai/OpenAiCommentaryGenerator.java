package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.exception.GenerationException;
import com.dailycode.domain.delivery.model.Commentary;
import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.delivery.service.CommentaryGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.models.ResponseFormatJsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiCommentaryGenerator implements CommentaryGenerator {

    private static final int MAX_QUIPS = 5;

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    @Value("${openai.commentary.temperature:0.9}")
    private double temperature;

    @Value("${openai.commentary.max-tokens:400}")
    private int maxTokens;

    @Override
    public Commentary embellish(ProblemPayload problem, Solution solution) {
        LlmCallResult result = llmClient.call("embellish",
                promptBuilder.getCommentarySystemPrompt(),
                promptBuilder.buildCommentaryUserMessage(problem, solution),
                temperature, maxTokens, ResponseFormatJsonObject.builder().build());

        return parse(result.content());
    }

    Commentary parse(String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Commentary response is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new GenerationException("Commentary response is not a JSON object");
        }

        List<String> quips = new ArrayList<>();
        JsonNode quipsNode = node.path("quips");
        if (quipsNode.isArray()) {
            for (JsonNode quip : quipsNode) {
                if (quips.size() == MAX_QUIPS) {
                    break;
                }
                if (!quip.asText().isBlank()) {
                    quips.add(quip.asText().strip());
                }
            }
        }
        Commentary commentary = new Commentary(
                node.path("intro").asText("").strip(),
                List.copyOf(quips),
                node.path("outro").asText("").strip());
        if (commentary.isEmpty()) {
            throw new GenerationException("Commentary response has no usable content");
        }
        return commentary;
    }
}
