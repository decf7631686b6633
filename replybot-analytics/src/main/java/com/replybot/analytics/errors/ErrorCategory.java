package com.replybot.analytics.errors;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse buckets for send-failure messages. */
public enum ErrorCategory {
    NETWORK("Network Error"),
    AUTHENTICATION("Authentication Error"),
    RATE_LIMIT("Rate Limit"),
    MEDIA("Media Error"),
    INVALID_FORMAT("Invalid Format"),
    UNKNOWN("Unknown Error");

    private final String label;

    ErrorCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
