package com.replybot.channel.transport;

/**
 * Recipient normalization for the chat transport.
 */
public final class PhoneNumbers {

    public static final String USER_SUFFIX = "@c.us";

    private PhoneNumbers() {
    }

    /**
     * Convert a free-form recipient into a chat id.
     * Ids that already carry a domain ({@code @c.us}, {@code @g.us}) pass
     * through; anything else keeps its digits and gets {@code @c.us}, so
     * {@code "+44 (20) 123"} becomes {@code "4420123@c.us"}.
     *
     * @throws IllegalArgumentException when no digits remain
     */
    public static String toChatId(String recipient) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("Recipient is required");
        }
        String trimmed = recipient.trim();
        if (trimmed.contains("@")) {
            return trimmed;
        }
        String digits = trimmed.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("Recipient has no digits: " + recipient);
        }
        return digits + USER_SUFFIX;
    }
}
