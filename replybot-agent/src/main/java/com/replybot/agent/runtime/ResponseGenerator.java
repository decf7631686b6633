package com.replybot.agent.runtime;

import com.replybot.agent.models.ProviderFactory;
import com.replybot.agent.models.ResponseProvider;
import com.replybot.agent.prompt.GenerationContext;
import com.replybot.agent.prompt.SystemPromptBuilder;
import com.replybot.common.config.LlmProvider;
import com.replybot.common.config.LlmSettings;
import com.replybot.common.infra.ErrorUtils;
import com.replybot.common.logging.SecretRedactor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Timeout-bound reply generation over the configured {@link ResponseProvider}.
 * <p>
 * Fails closed: until {@link #initialize(LlmSettings)} has built a provider
 * and its connection test succeeded, every {@link #generate} call fails
 * with {@link GenerationException.Reason#NOT_READY}.
 */
@Slf4j
public class ResponseGenerator {

    private final ProviderFactory providerFactory;
    private final Clock clock;

    private volatile LlmSettings settings = new LlmSettings();
    private volatile ResponseProvider provider;
    private volatile boolean initialized;

    public ResponseGenerator(ProviderFactory providerFactory) {
        this(providerFactory, Clock.systemUTC());
    }

    public ResponseGenerator(ProviderFactory providerFactory, Clock clock) {
        this.providerFactory = providerFactory;
        this.clock = clock;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Build the provider for {@code next} and test its connection. Blocks for at most the
     * configured timeout.
     *
     * @return whether the generator is ready
     */
    public synchronized boolean initialize(LlmSettings next) {
        this.settings = next;
        this.initialized = false;
        this.provider = null;

        if (!next.isEnabled()) {
            log.info("[llm] Disabled in settings");
            return false;
        }

        ResponseProvider candidate;
        try {
            candidate = providerFactory.create(next);
        } catch (IllegalArgumentException e) {
            log.warn("[llm] Cannot initialize {}: {}", next.getProvider().getId(), e.getMessage());
            return false;
        }

        try {
            boolean ok = candidate.testConnection(next.getModel())
                    .orTimeout(next.getTimeoutMs(), TimeUnit.MILLISECONDS)
                    .join();
            if (!ok) {
                log.warn("[llm] Connection test for {} returned no content", candidate.getId());
                return false;
            }
        } catch (CompletionException | CancellationException e) {
            log.warn("[llm] Connection test for {} failed: {}", candidate.getId(),
                    SecretRedactor.redact(ErrorUtils.formatErrorMessage(e)));
            return false;
        }

        this.provider = candidate;
        this.initialized = true;
        log.info("[llm] Initialized with provider: {} (model {})", candidate.getId(), next.getModel());
        return true;
    }

    /**
     * Swap settings. The provider is rebuilt and tested again only when
     * {@link LlmSettings#requiresReinitialization} says so.
     *
     * @return whether the generator is ready afterwards
     */
    public synchronized boolean updateSettings(LlmSettings next) {
        if (next.requiresReinitialization(settings)) {
            log.info("[llm] Settings changed, re-initializing");
            return initialize(next);
        }
        this.settings = next;
        return initialized;
    }

    public boolean isReady() {
        return initialized && settings.isEnabled() && provider != null;
    }

    public LlmSettings getSettings() {
        return settings;
    }

    // ── Generation ──────────────────────────────────────────────────────

    /**
     * Generate a reply to {@code userText}.
     * <p>
     * Completes exceptionally with a {@link GenerationException} (wrapped in a
     * {@link CompletionException} when observed through {@code join}).
     * Cancelling the returned future cancels the provider call.
     */
    public CompletableFuture<String> generate(String userText, GenerationContext context) {
        LlmSettings current = settings;
        ResponseProvider active = provider;
        if (!initialized || !current.isEnabled() || active == null) {
            return CompletableFuture.failedFuture(
                    new GenerationException(GenerationException.Reason.NOT_READY, "LLM service not initialized"));
        }

        ResponseProvider.GenerationRequest request = ResponseProvider.GenerationRequest.builder()
                .model(current.getModel())
                .systemPrompt(SystemPromptBuilder.build(current.getSystemPrompt(), context))
                .userMessage(userText)
                .maxTokens(current.getMaxTokens())
                .temperature(current.getTemperature())
                .headers(current.getHeaders())
                .context(context)
                .build();

        CompletableFuture<String> call;
        try {
            call = active.generate(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(translate(e, current));
        }

        long startedAt = clock.millis();
        CompletableFuture<String> result = call
                .orTimeout(current.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((text, err) -> {
                    if (err != null) {
                        throw translate(err, current);
                    }
                    if (text == null || text.isBlank()) {
                        throw new GenerationException(GenerationException.Reason.EMPTY_RESPONSE,
                                active.getId() + " returned an empty response");
                    }
                    log.debug("[llm] Generated reply via {} in {}ms", active.getId(), clock.millis() - startedAt);
                    return text.trim();
                });
        result.whenComplete((text, err) -> {
            if (result.isCancelled()) {
                call.cancel(true);
            }
        });
        return result;
    }

    private static GenerationException translate(Throwable err, LlmSettings settings) {
        Throwable cause = ErrorUtils.unwrap(err);
        if (cause instanceof GenerationException ge) {
            return ge;
        }
        if (cause instanceof TimeoutException) {
            return new GenerationException(GenerationException.Reason.TIMEOUT,
                    "Request timeout after " + settings.getTimeoutMs() + "ms", cause);
        }
        return new GenerationException(GenerationException.Reason.PROVIDER_ERROR,
                SecretRedactor.redact(ErrorUtils.formatErrorMessage(cause)), cause);
    }

    // ── Introspection ───────────────────────────────────────────────────

    public Status getStatus() {
        LlmSettings current = settings;
        return new Status(initialized, current.isEnabled(), current.getProvider(), current.getModel(),
                current.getRateLimitPerHour());
    }

    /**
     * Health check: tests the provider connection when initialized and enabled.
     */
    public CompletableFuture<Health> getHealth() {
        LlmSettings current = settings;
        ResponseProvider active = provider;
        Instant now = Instant.now(clock);
        if (!initialized || active == null) {
            return CompletableFuture.completedFuture(
                    new Health("error", "LLM service not initialized", current.getProvider(), current.getModel(), now));
        }
        if (!current.isEnabled()) {
            return CompletableFuture.completedFuture(
                    new Health("disabled", "LLM service disabled in settings", current.getProvider(),
                            current.getModel(), now));
        }
        return active.testConnection(current.getModel())
                .orTimeout(current.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((ok, err) -> {
                    if (err != null) {
                        return new Health("error", SecretRedactor.redact(ErrorUtils.formatErrorMessage(err)),
                                current.getProvider(), current.getModel(), Instant.now(clock));
                    }
                    return new Health(Boolean.TRUE.equals(ok) ? "healthy" : "error",
                            Boolean.TRUE.equals(ok) ? null : "Empty connection test response",
                            current.getProvider(), current.getModel(), Instant.now(clock));
                });
    }

    /**
     * Settings view safe to show to operators: no API key, no headers.
     */
    public PublicSettings getPublicSettings() {
        LlmSettings s = settings;
        return new PublicSettings(s.isEnabled(), s.isAutoReply(), s.isOnlyDuringBusinessHours(),
                s.getProvider(), s.getModel(), s.getBaseUrl(), s.getCustomEndpoint(),
                s.getMaxTokens(), s.getTemperature(), s.getSystemPrompt(), s.getFallbackMessage(),
                s.getRateLimitPerHour(), s.getTimeoutMs(),
                s.getApiKey() != null && !s.getApiKey().isBlank(), initialized);
    }

    // ── Views ───────────────────────────────────────────────────────────

    public record Status(boolean initialized, boolean enabled, LlmProvider provider, String model,
            int rateLimitPerHour) {
    }

    public record Health(String status, String message, LlmProvider provider, String model,
            Instant lastChecked) {
    }

    public record PublicSettings(
            boolean enabled,
            boolean autoReply,
            boolean onlyDuringBusinessHours,
            LlmProvider provider,
            String model,
            String baseUrl,
            String customEndpoint,
            int maxTokens,
            double temperature,
            String systemPrompt,
            String fallbackMessage,
            int rateLimitPerHour,
            long timeoutMs,
            boolean hasApiKey,
            boolean initialized) {
    }
}
