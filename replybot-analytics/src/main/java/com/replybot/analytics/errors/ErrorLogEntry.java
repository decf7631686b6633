package com.replybot.analytics.errors;

import java.time.Instant;

/**
 * One failed delivery in the error log.
 */
public record ErrorLogEntry(
        Instant timestamp,
        ErrorCategory category,
        String error,
        String messageId,
        String contact) {
}
