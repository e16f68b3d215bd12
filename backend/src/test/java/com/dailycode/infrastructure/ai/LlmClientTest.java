package com.dailycode.infrastructure.ai;

import com.dailycode.domain.delivery.exception.GenerationException;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.completions.CompletionUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmClientTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private OpenAIClient openAIClient;

    @Mock
    private ChatCompletion completion;

    private final TokenUsageTracker usageTracker = new TokenUsageTracker();
    private LlmClient client;

    @BeforeEach
    void setUp() {
        client = new LlmClient(openAIClient, usageTracker);
        ReflectionTestUtils.setField(client, "model", "llama-3.1-8b-instant");
    }

    private LlmCallResult call() {
        return client.call("solve", "system", "user", 0.3, 2000, null);
    }

    private void respondWith(List<ChatCompletion.Choice> choices) {
        CompletionUsage usage = mock(CompletionUsage.class);
        when(usage.promptTokens()).thenReturn(120L);
        when(usage.completionTokens()).thenReturn(480L);
        when(completion.usage()).thenReturn(Optional.of(usage));
        when(completion.choices()).thenReturn(choices);
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class))).thenReturn(completion);
    }

    @Test
    @DisplayName("returns the trimmed content and counts its tokens")
    void success() {
        ChatCompletion.Choice choice = mock(ChatCompletion.Choice.class, Answers.RETURNS_DEEP_STUBS);
        when(choice.message().content()).thenReturn(Optional.of("  ## Approach\nUse a map.  "));
        respondWith(List.of(choice));

        LlmCallResult result = call();

        assertThat(result.content()).isEqualTo("## Approach\nUse a map.");
        assertThat(result.promptTokens()).isEqualTo(120);
        assertThat(usageTracker.snapshot())
                .isEqualTo(new TokenUsageTracker.Snapshot(1, 0, 120, 480));
    }

    @Test
    @DisplayName("a response without content counts as one failed request")
    void emptyResponse() {
        respondWith(List.of());

        assertThatThrownBy(this::call)
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("has no content");
        assertThat(usageTracker.snapshot())
                .isEqualTo(new TokenUsageTracker.Snapshot(1, 1, 120, 480));
    }

    @Test
    @DisplayName("a failed call counts as one failed request without tokens")
    void callFails() {
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class)))
                .thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(this::call)
                .isInstanceOf(GenerationException.class)
                .hasRootCauseMessage("connection reset");
        assertThat(usageTracker.snapshot())
                .isEqualTo(new TokenUsageTracker.Snapshot(1, 1, 0, 0));
    }
}
