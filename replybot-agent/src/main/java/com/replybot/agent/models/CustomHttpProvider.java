package com.replybot.agent.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replybot.agent.prompt.GenerationContext;
import okhttp3.OkHttpClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Operator-supplied HTTP endpoint.
 * <p>
 * Request: {@code {message, context, settings: {maxTokens, temperature, systemPrompt}}}.
 * Response: the {@code response} field, else {@code message}.
 */
public class CustomHttpProvider extends AbstractHttpProvider {

    private final String endpoint;

    public CustomHttpProvider(OkHttpClient httpClient, ObjectMapper objectMapper, String endpoint) {
        super(httpClient, objectMapper);
        this.endpoint = endpoint;
    }

    @Override
    public String getId() {
        return "custom";
    }

    @Override
    public String getApiBaseUrl() {
        return endpoint;
    }

    @Override
    public CompletableFuture<String> generate(GenerationRequest request) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("maxTokens", request.getMaxTokens());
        settings.put("temperature", request.getTemperature());
        settings.put("systemPrompt", request.getSystemPrompt());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", request.getUserMessage());
        body.put("context", contextBody(request.getContext()));
        body.put("settings", settings);

        return postJson(endpoint, body, request.getHeaders(), CustomHttpProvider::extractReply);
    }

    private static Map<String, Object> contextBody(GenerationContext context) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (context == null) {
            return map;
        }
        map.put("sender", context.getSenderId());
        map.put("senderName", context.getSenderName());
        map.put("isGroup", context.isGroup());
        if (context.getBusinessHours() != null) {
            map.put("businessHours", context.getBusinessHours());
        }
        return map;
    }

    static String extractReply(JsonNode root) {
        String response = root.path("response").asText("");
        return !response.isEmpty() ? response : root.path("message").asText("");
    }
}
