package com.replybot.agent.models;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * JSON-over-HTTP plumbing shared by the providers.
 */
public abstract class AbstractHttpProvider implements ResponseProvider {

    protected static final MediaType JSON = MediaType.parse("application/json");
    private static final int MAX_ERROR_BODY = 500;

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpProvider(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * POST {@code body} as JSON and map the JSON response with {@code extractor}
     * on the callback thread.
     * Completing the returned future from outside (timeout, cancellation)
     * cancels the call.
     */
    protected <T> CompletableFuture<T> postJson(String url, Object body, Map<String, String> headers,
            Function<JsonNode, T> extractor) {
        CompletableFuture<T> future = new CompletableFuture<>();

        Request request;
        try {
            String jsonBody = objectMapper.writeValueAsString(body);
            Request.Builder builder = new Request.Builder()
                    .url(url)
                    .header("content-type", "application/json")
                    .post(RequestBody.create(jsonBody, JSON));
            if (headers != null) {
                headers.forEach(builder::header);
            }
            request = builder.build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            future.completeExceptionally(e);
            return future;
        }

        Call call = httpClient.newCall(request);
        future.whenComplete((result, err) -> {
            if (err != null) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String text = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(new IOException(
                                getId() + " API error " + response.code() + ": " + truncate(text)));
                        return;
                    }
                    future.complete(extractor.apply(objectMapper.readTree(text.isEmpty() ? "{}" : text)));
                } catch (IOException | RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    protected static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String truncate(String text) {
        return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "…" : text;
    }
}
