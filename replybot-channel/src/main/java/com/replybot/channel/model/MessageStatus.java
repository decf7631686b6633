package com.replybot.channel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery status of a message.
 * Inbound messages are stored as {@link #RECEIVED}; outbound messages move
 * through the ack levels reported by the transport.
 */
public enum MessageStatus {
    PENDING("pending"),
    SENT("sent"),
    DELIVERED("delivered"),
    READ("read"),
    FAILED("failed"),
    RECEIVED("received"),
    UNKNOWN("unknown");

    private final String id;

    MessageStatus(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static MessageStatus fromId(String id) {
        for (MessageStatus s : values()) {
            if (s.id.equalsIgnoreCase(id)) {
                return s;
            }
        }
        return UNKNOWN;
    }

    /**
     * Map a transport ack level to a status.
     * {@code 0} pending, {@code 1} sent, {@code 2} delivered, {@code 3} read,
     * {@code -1} failed; anything else is unknown.
     */
    public static MessageStatus fromAck(int ack) {
        return switch (ack) {
            case 0 -> PENDING;
            case 1 -> SENT;
            case 2 -> DELIVERED;
            case 3 -> READ;
            case -1 -> FAILED;
            default -> UNKNOWN;
        };
    }
}
