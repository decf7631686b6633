package com.replybot.channel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical chat message, inbound or outbound.
 * <p>
 * Only {@code status} and {@code statusUpdatedAt} change after the message
 * has been persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /** Prefix of ids assigned to outbound messages the transport refused. */
    public static final String FAILED_ID_PREFIX = "failed_";

    private String id;
    /** Sender identifier (inbound), bot account for outbound. */
    private String sender;
    private String senderName;
    /** Recipient identifier (outbound), bot account for inbound. */
    private String recipient;
    private String content;
    @Builder.Default
    private MessageKind kind = MessageKind.TEXT;
    private MessageDirection direction;
    private MessageStatus status;
    private Instant timestamp;
    @JsonProperty("isGroup")
    private boolean group;
    private String chatId;
    private boolean fromMe;
    private boolean hasMedia;
    private String mediaPath;
    /** Send error text for failed outbound messages. */
    private String error;
    private Instant statusUpdatedAt;

    @JsonIgnore
    public boolean isIncoming() {
        return direction == MessageDirection.INCOMING;
    }

    @JsonIgnore
    public boolean isOutgoing() {
        return direction == MessageDirection.OUTGOING;
    }

    /**
     * The other party of the conversation: sender for inbound, recipient
     * for outbound.
     */
    public String contact() {
        return sender != null && isIncoming() ? sender : (recipient != null ? recipient : sender);
    }
}
