package com.replybot.channel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Content kind as reported by the transport. */
public enum MessageKind {
    TEXT("text"),
    IMAGE("image"),
    VIDEO("video"),
    AUDIO("audio"),
    DOCUMENT("document"),
    STICKER("sticker"),
    LOCATION("location"),
    OTHER("other");

    private final String id;

    MessageKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static MessageKind fromId(String id) {
        if (id == null) {
            return TEXT;
        }
        for (MessageKind k : values()) {
            if (k.id.equalsIgnoreCase(id)) {
                return k;
            }
        }
        // transports report "chat" for plain text and "ptt" for voice notes
        return switch (id.toLowerCase()) {
            case "chat" -> TEXT;
            case "ptt" -> AUDIO;
            default -> OTHER;
        };
    }
}
