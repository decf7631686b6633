package com.replybot.agent.models;

import com.replybot.agent.prompt.GenerationContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A language-model backend that turns one user message into one reply.
 * <p>
 * Returned futures must cancel the underlying HTTP call when they are
 * completed exceptionally from outside (timeout or cancellation).
 */
public interface ResponseProvider {

    /** Provider identifier (e.g. "openai", "gemini"). */
    String getId();

    /** API base URL or endpoint. */
    String getApiBaseUrl();

    /**
     * Generate a reply. Completes with the raw provider text, which may be
     * empty.
     */
    CompletableFuture<String> generate(GenerationRequest request);

    /**
     * Check the backend with a minimal request. Providers that have no cheap
     * check report success.
     */
    default CompletableFuture<Boolean> testConnection(String model) {
        return CompletableFuture.completedFuture(true);
    }

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class GenerationRequest {
        private String model;
        private String systemPrompt;
        private String userMessage;
        private int maxTokens;
        private double temperature;
        /** Extra HTTP headers. */
        private Map<String, String> headers;
        private GenerationContext context;
    }
}
