package com.replybot.analytics.errors;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classification of error text. Rules are checked in order and the
 * first match wins, so "Connection timeout to authentication server" is a
 * network error.
 */
public final class ErrorCategorizer {

    private ErrorCategorizer() {
    }

    private record Rule(ErrorCategory category, List<String> keywords) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(ErrorCategory.NETWORK, List.of("network", "connection")),
            new Rule(ErrorCategory.AUTHENTICATION, List.of("auth")),
            new Rule(ErrorCategory.RATE_LIMIT, List.of("rate", "limit")),
            new Rule(ErrorCategory.MEDIA, List.of("media", "file")),
            new Rule(ErrorCategory.INVALID_FORMAT, List.of("invalid", "format")));

    public static ErrorCategory categorize(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            return ErrorCategory.UNKNOWN;
        }
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (lower.contains(keyword)) {
                    return rule.category();
                }
            }
        }
        return ErrorCategory.UNKNOWN;
    }
}
