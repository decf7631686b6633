package com.replybot.agent.models;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Local Ollama provider ({@code POST /api/generate}, non-streaming).
 */
public class OllamaProvider extends AbstractHttpProvider {

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama2";

    private final String baseUrl;

    public OllamaProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        super(httpClient, objectMapper);
        this.baseUrl = trimTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL);
    }

    @Override
    public String getId() {
        return "ollama";
    }

    @Override
    public String getApiBaseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("temperature", request.getTemperature());
        options.put("num_predict", request.getMaxTokens());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel() : DEFAULT_MODEL);
        body.put("prompt", request.getSystemPrompt() + "\n\nUser: " + request.getUserMessage() + "\nAssistant:");
        body.put("stream", false);
        body.put("options", options);

        return postJson(baseUrl + "/api/generate", body, request.getHeaders(),
                root -> root.path("response").asText(""));
    }
}
