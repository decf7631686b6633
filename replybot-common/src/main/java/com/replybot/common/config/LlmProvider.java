package com.replybot.common.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supported language-model backends.
 */
public enum LlmProvider {
    OPENAI("openai"),
    GEMINI("gemini"),
    OLLAMA("ollama"),
    CUSTOM("custom");

    private final String id;

    LlmProvider(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static LlmProvider fromId(String id) {
        if (id == null) {
            return null;
        }
        for (LlmProvider p : values()) {
            if (p.id.equalsIgnoreCase(id.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unsupported LLM provider: " + id);
    }
}
