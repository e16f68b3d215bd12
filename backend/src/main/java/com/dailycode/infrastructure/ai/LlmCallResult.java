package com.dailycode.infrastructure.ai;

/**
 * Result of an LLM API call including token usage for cost tracking.
 */
public record LlmCallResult(String content, long promptTokens, long completionTokens) {}
