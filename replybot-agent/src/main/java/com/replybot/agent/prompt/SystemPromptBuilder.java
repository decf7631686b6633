package com.replybot.agent.prompt;

/**
 * Builds the system prompt sent with every generation request.
 */
public final class SystemPromptBuilder {

    static final String GROUP_NOTE = "\n\nNote: This is a group chat conversation.";
    static final String AFTER_HOURS_NOTE = "\n\nNote: This is outside business hours, so keep responses brief "
            + "and mention business hours if relevant.";

    private SystemPromptBuilder() {
    }

    /**
     * Append context notes to the operator's base prompt: group chat,
     * addressee name, then after-hours.
     */
    public static String build(String basePrompt, GenerationContext context) {
        StringBuilder prompt = new StringBuilder(basePrompt != null ? basePrompt : "");
        if (context == null) {
            return prompt.toString();
        }
        if (context.isGroup()) {
            prompt.append(GROUP_NOTE);
        }
        if (context.getSenderName() != null && !context.getSenderName().isBlank()) {
            prompt.append("\n\nYou are responding to ").append(context.getSenderName()).append('.');
        }
        if (Boolean.FALSE.equals(context.getBusinessHours())) {
            prompt.append(AFTER_HOURS_NOTE);
        }
        return prompt.toString();
    }
}
