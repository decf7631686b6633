package com.replybot.channel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which way a message travelled relative to the bot account.
 */
public enum MessageDirection {
    INCOMING("incoming"),
    OUTGOING("outgoing");

    private final String id;

    MessageDirection(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static MessageDirection fromId(String id) {
        for (MessageDirection d : values()) {
            if (d.id.equalsIgnoreCase(id)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown message direction: " + id);
    }
}
