package com.replybot.agent.prompt;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversation context folded into the system prompt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationContext {
    private String senderId;
    private String senderName;
    private boolean group;
    /** {@code FALSE} adds the after-hours note; {@code null} means unknown. */
    private Boolean businessHours;
}
