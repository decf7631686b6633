package com.replybot.agent.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Google Gemini provider over the Generative Language REST API
 * ({@code models/{model}:generateContent}).
 * <p>
 * System prompt and user text are sent as one prompt:
 * {@code <system>\n\nUser: <text>\n\nAssistant:}.
 */
public class GeminiProvider extends AbstractHttpProvider {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private final String apiKey;
    private final String baseUrl;

    public GeminiProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String apiKey, String baseUrl) {
        super(httpClient, objectMapper);
        this.apiKey = apiKey;
        this.baseUrl = trimTrailingSlash(baseUrl != null && !baseUrl.isBlank() ? baseUrl : DEFAULT_BASE_URL);
    }

    @Override
    public String getId() {
        return "gemini";
    }

    @Override
    public String getApiBaseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        String prompt = request.getSystemPrompt() + "\n\nUser: " + request.getUserMessage() + "\n\nAssistant:";

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("maxOutputTokens", request.getMaxTokens());
        generationConfig.put("temperature", request.getTemperature());

        return call(request.getModel(), prompt, generationConfig, request.getHeaders(),
                GeminiProvider::extractText);
    }

    @Override
    public CompletableFuture<Boolean> testConnection(String model) {
        return call(model, "Hello", null, null, root -> !extractText(root).isEmpty());
    }

    private <T> CompletableFuture<T> call(String model, String prompt, Map<String, Object> generationConfig,
            Map<String, String> extraHeaders, Function<JsonNode, T> extractor) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));
        if (generationConfig != null) {
            body.put("generationConfig", generationConfig);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (extraHeaders != null) {
            headers.putAll(extraHeaders);
        }
        headers.put("x-goog-api-key", apiKey);

        String modelPath = model.startsWith("models/") ? model : "models/" + model;
        return postJson(baseUrl + "/" + modelPath + ":generateContent", body, headers, extractor);
    }

    static String extractText(JsonNode root) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }
}
