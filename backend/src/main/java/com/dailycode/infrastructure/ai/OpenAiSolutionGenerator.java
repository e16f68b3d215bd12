package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.model.ProblemPayload;
import com.dailycode.domain.delivery.model.Solution;
import com.dailycode.domain.delivery.service.SolutionGenerator;
import com.dailycode.domain.subscriber.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiSolutionGenerator implements SolutionGenerator {

    private final LlmClient llmClient;
    private final PromptBuilder promptBuilder;
    private final SolutionResponseParser responseParser;

    @Value("${openai.solve.temperature:0.3}")
    private double temperature;

    @Value("${openai.solve.max-tokens:2000}")
    private int maxTokens;

    @Override
    public Solution generate(ProblemPayload problem, Language language) {
        log.info("Generating solution - problem: {}, language: {}", problem.id(), language.code());

        LlmCallResult result = llmClient.call("solve",
                promptBuilder.getSolveSystemPrompt(),
                promptBuilder.buildSolveUserMessage(problem, language),
                temperature, maxTokens, null);

        return responseParser.parse(result.content(), language);
    }

    @Override
    public boolean isReachable() {
        return llmClient.isReachable();
    }
}
