package com.replybot.common.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmSettingsTest {

    private final LlmSettings base = LlmSettings.builder()
            .enabled(true)
            .provider(LlmProvider.OPENAI)
            .apiKey("key-1")
            .build();

    @Test
    void parameterOnlyChanges_doNotRequireReinitialization() {
        LlmSettings next = base.toBuilder()
                .maxTokens(300)
                .temperature(0.2)
                .systemPrompt("Be brief.")
                .rateLimitPerHour(5)
                .build();
        assertFalse(next.requiresReinitialization(base));
    }

    @Test
    void credentialChange_requiresReinitialization() {
        assertTrue(base.toBuilder().apiKey("key-2").build().requiresReinitialization(base));
    }

    @Test
    void providerOrEnablementChange_requiresReinitialization() {
        assertTrue(base.toBuilder().provider(LlmProvider.GEMINI).build().requiresReinitialization(base));
        assertTrue(base.toBuilder().enabled(false).build().requiresReinitialization(base));
        assertTrue(base.requiresReinitialization(null));
    }

    @Test
    void providerIds_parseCaseInsensitively() {
        assertEquals(LlmProvider.OLLAMA, LlmProvider.fromId("Ollama"));
        assertThrows(IllegalArgumentException.class, () -> LlmProvider.fromId("bard"));
    }
}
