package com.replybot.common.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Language-model settings bundle.
 * Read-mostly; swapping it at runtime re-initializes the provider only when
 * {@link #requiresReinitialization(LlmSettings)} says so.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LlmSettings {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a helpful WhatsApp bot assistant. Respond naturally "
            + "and helpfully to user messages. Keep responses concise and friendly.";

    public static final String DEFAULT_FALLBACK_MESSAGE = "I apologize, but I cannot process your message right now. "
            + "Please try again later.";

    /** Master switch for the LLM service. */
    @Builder.Default
    private boolean enabled = false;

    /** Use the LLM for auto-replies (otherwise static messages only). */
    @Builder.Default
    private boolean autoReply = true;

    /** Skip the LLM outside business hours. */
    @Builder.Default
    private boolean onlyDuringBusinessHours = false;

    @Builder.Default
    private LlmProvider provider = LlmProvider.GEMINI;

    @Builder.Default
    private String model = "gemini-1.5-flash";

    private String apiKey;

    /** Base URL for OpenAI-compatible and Ollama providers. */
    private String baseUrl;

    /** Endpoint for the custom HTTP provider. */
    private String customEndpoint;

    /** Extra headers sent by the Ollama and custom providers. */
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private int maxTokens = 150;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private String systemPrompt = DEFAULT_SYSTEM_PROMPT;

    @Builder.Default
    private String fallbackMessage = DEFAULT_FALLBACK_MESSAGE;

    @Builder.Default
    private int rateLimitPerHour = 60;

    @Builder.Default
    private long timeoutMs = 10_000;

    /**
     * Whether switching from {@code previous} to these settings needs the
     * provider rebuilt and its connection tested again. Parameter-only changes (model,
     * tokens, temperature, prompt, headers, limits) are read per call.
     */
    public boolean requiresReinitialization(LlmSettings previous) {
        if (previous == null) {
            return true;
        }
        return enabled != previous.enabled
                || provider != previous.provider
                || !Objects.equals(apiKey, previous.apiKey)
                || !Objects.equals(baseUrl, previous.baseUrl)
                || !Objects.equals(customEndpoint, previous.customEndpoint);
    }
}
