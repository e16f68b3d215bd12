package com.dailycode.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide LLM request and token counters.
 */
@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    /**
     * A request that got a response, whether or not the response was usable.
     */
    public void recordUsage(String purpose, long promptTokens, long completionTokens) {
        long requests = totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.debug("Token usage [{}] - request #{}: prompt={}, completion={}, cumulative: prompt={}, completion={}",
                purpose, requests, promptTokens, completionTokens,
                totalPromptTokens.get(), totalCompletionTokens.get());
    }

    /**
     * A request already counted by {@link #recordUsage} whose response had no content.
     */
    public void recordUnusableResponse() {
        failedRequests.incrementAndGet();
    }

    /**
     * A request that never got a response.
     */
    public void recordFailure() {
        totalRequests.incrementAndGet();
        failedRequests.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(totalRequests.get(), failedRequests.get(),
                totalPromptTokens.get(), totalCompletionTokens.get());
    }

    public record Snapshot(long requests, long failedRequests, long promptTokens, long completionTokens) {

        public String describe() {
            return requests + " requests (" + failedRequests + " failed), "
                    + promptTokens + " prompt + " + completionTokens + " completion tokens";
        }
    }
}
