package com.replybot.autoreply;

import com.fasterxml.jackson.annotation.JsonValue;

/** Origin of an auto-reply text. */
public enum ResponseType {
    LLM("llm"),
    DEFAULT("default"),
    AFTER_HOURS("afterHours");

    private final String id;

    ResponseType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
