package com.replybot.agent.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.replybot.common.config.LlmSettings;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.time.Duration;

/**
 * Builds the {@link ResponseProvider} selected by the settings.
 * One HTTP client is shared by every provider this factory creates.
 */
@Slf4j
public class ProviderFactory {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ProviderFactory() {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .writeTimeout(Duration.ofSeconds(10))
                .build(), new ObjectMapper());
    }

    public ProviderFactory(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when a required credential or
     *                                  endpoint is missing
     */
    public ResponseProvider create(LlmSettings settings) {
        ResponseProvider provider = switch (settings.getProvider()) {
            case OPENAI -> new OpenAICompatibleProvider(httpClient, objectMapper,
                    requireApiKey(settings), settings.getBaseUrl());
            case GEMINI -> new GeminiProvider(httpClient, objectMapper,
                    requireApiKey(settings), settings.getBaseUrl());
            case OLLAMA -> new OllamaProvider(httpClient, objectMapper, settings.getBaseUrl());
            case CUSTOM -> {
                if (settings.getCustomEndpoint() == null || settings.getCustomEndpoint().isBlank()) {
                    throw new IllegalArgumentException("Custom provider requires customEndpoint");
                }
                yield new CustomHttpProvider(httpClient, objectMapper, settings.getCustomEndpoint());
            }
        };
        log.debug("[llm] Created provider {} at {}", provider.getId(), provider.getApiBaseUrl());
        return provider;
    }

    private static String requireApiKey(LlmSettings settings) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new IllegalArgumentException(settings.getProvider().getId() + " API key not provided");
        }
        return settings.getApiKey();
    }
}
