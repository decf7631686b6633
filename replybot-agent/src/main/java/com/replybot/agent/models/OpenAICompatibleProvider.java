package com.replybot.agent.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * OpenAI chat-completions provider.
 * Works with any endpoint that speaks the same protocol (Azure proxies, vLLM, LM Studio).
 */
public class OpenAICompatibleProvider extends AbstractHttpProvider {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final String apiKey;
    private final String baseUrl;

    public OpenAICompatibleProvider(OkHttpClient httpClient, ObjectMapper objectMapper,
            String apiKey, String baseUrl) {
        super(httpClient, objectMapper);
        this.apiKey = apiKey;
        this.baseUrl = trimTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL);
    }

    @Override
    public String getId() {
        return "openai";
    }

    @Override
    public String getApiBaseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel());

        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isEmpty()) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.getUserMessage()));
        body.put("messages", messages);
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());

        return postJson(baseUrl + "/chat/completions", body, headers(request.getHeaders()),
                OpenAICompatibleProvider::extractContent);
    }

    @Override
    public CompletableFuture<Boolean> testConnection(String model) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", "Hello")));
        body.put("max_tokens", 5);
        return postJson(baseUrl + "/chat/completions", body, headers(null),
                root -> !extractContent(root).isEmpty());
    }

    private Map<String, String> headers(Map<String, String> extra) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (extra != null) {
            headers.putAll(extra);
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            headers.put("Authorization", "Bearer " + apiKey);
        }
        return headers;
    }

    static String extractContent(JsonNode root) {
        return root.path("choices").path(0).path("message").path("content").asText("");
    }
}
