package com.replybot.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach log output or public settings views.
 */
public final class SecretRedactor {

    private SecretRedactor() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<Pattern> PATTERNS = List.of(
            // JSON fields
            Pattern.compile("\"(?:apiKey|api_key|token|secret|password)\"\\s*:\\s*\"([^\"]+)\"",
                    Pattern.CASE_INSENSITIVE),
            // Authorization headers
            Pattern.compile("Authorization\\s*[:=]\\s*Bearer\\s+([A-Za-z0-9._\\-+=]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=]{18,})\\b"),
            // Query-string keys (Gemini REST URLs)
            Pattern.compile("[?&]key=([A-Za-z0-9._\\-]+)"),
            // Common token prefixes
            Pattern.compile("\\b(sk-[A-Za-z0-9_-]{8,})\\b"),
            Pattern.compile("\\b(AIza[0-9A-Za-z\\-_]{20,})\\b"));

    /**
     * Redact known credential shapes in free text.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String full = matcher.group(0);
                String token = matcher.group(1);
                matcher.appendReplacement(sb, Matcher.quoteReplacement(full.replace(token, maskToken(token))));
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }
}
