package com.replybot.autoreply;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit entry for one auto-reply send attempt. Append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoReplyRecord {
    private String sender;
    private String senderName;
    private String requestText;
    private String responseText;
    private ResponseType responseType;
    @JsonProperty("isGroup")
    private boolean group;
    @JsonProperty("isWorkingHours")
    private boolean workingHours;
    /** Whether the transport accepted the reply. */
    private boolean sent;
    private String error;
    private Instant timestamp;
}
