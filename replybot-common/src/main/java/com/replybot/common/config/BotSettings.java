package com.replybot.common.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator settings consumed read-only by the auto-reply pipeline.
 * Persisted by the message store and hot-swappable at runtime.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BotSettings {

    public static final String DEFAULT_AUTO_REPLY_MESSAGE = "Thanks for your message! We will get back to you soon.";

    public static final String DEFAULT_AFTER_HOURS_MESSAGE = "Thank you for your message. We are currently outside "
            + "business hours. We will respond as soon as possible during our working hours.";

    @Builder.Default
    private String botName = "ReplyBot";

    @Builder.Default
    private boolean autoReply = true;

    @Builder.Default
    private String autoReplyMessage = DEFAULT_AUTO_REPLY_MESSAGE;

    @Builder.Default
    private String afterHoursMessage = DEFAULT_AFTER_HOURS_MESSAGE;

    /** When non-empty only these senders are answered. */
    @Builder.Default
    private List<String> allowedContacts = new ArrayList<>();

    /** Never answered; takes precedence over {@link #allowedContacts}. */
    @Builder.Default
    private List<String> blockedContacts = new ArrayList<>();

    @Builder.Default
    private WorkingHours workingHours = new WorkingHours();

    @Builder.Default
    private LlmSettings llm = new LlmSettings();

    /**
     * Operator business-hours window, "HH:mm" strings evaluated in
     * {@code timezone}.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WorkingHours {
        /** When true the gate rejects messages arriving outside the window. */
        @Builder.Default
        private boolean enabled = false;
        @Builder.Default
        private String start = "09:00";
        @Builder.Default
        private String end = "17:00";
        @Builder.Default
        private String timezone = "UTC";
    }
}
