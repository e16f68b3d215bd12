package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.exception.GenerationException;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Pure LLM call wrapper shared by the solution and commentary generators.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private final OpenAIClient openAIClient;
    private final TokenUsageTracker usageTracker;

    @Value("${openai.model}")
    private String model;

    /**
     * @param purpose        short label for logs and usage tracking
     * @param temperature    sampling temperature
     * @param maxTokens      completion token limit
     * @param responseFormat JSON format (null for text)
     * @throws GenerationException when the call fails or returns no content
     */
    public LlmCallResult call(String purpose, String systemPrompt, String userMessage,
                              double temperature, int maxTokens, ResponseFormatJsonObject responseFormat) {
        ChatCompletion completion;
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage);

            if (responseFormat != null) {
                builder.responseFormat(responseFormat);
            }

            completion = openAIClient.chat().completions().create(builder.build());
        } catch (Exception e) {
            usageTracker.recordFailure();
            log.error("LLM call failed [{}, {}]", purpose, model, e);
            throw new GenerationException("Text generation failed for " + purpose, e);
        }

        long promptTokens = 0;
        long completionTokens = 0;
        if (completion.usage().isPresent()) {
            var usage = completion.usage().get();
            promptTokens = usage.promptTokens();
            completionTokens = usage.completionTokens();
        }
        usageTracker.recordUsage(purpose, promptTokens, completionTokens);

        Optional<String> content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content());
        if (content.isEmpty()) {
            usageTracker.recordUnusableResponse();
            throw new GenerationException("LLM response for " + purpose + " has no content");
        }
        return new LlmCallResult(content.get().trim(), promptTokens, completionTokens);
    }

    /**
     * Lists the endpoint's models without spending completion tokens.
     */
    public boolean isReachable() {
        try {
            openAIClient.models().list();
            return true;
        } catch (Exception e) {
            log.warn("LLM endpoint unreachable: {}", e.getMessage());
            return false;
        }
    }
}
