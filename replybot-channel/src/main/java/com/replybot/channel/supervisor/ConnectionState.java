package com.replybot.channel.supervisor;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Transport session lifecycle states.
 */
public enum ConnectionState {
    DISCONNECTED("disconnected"),
    INITIALIZING("initializing"),
    QR_PENDING("qr_received"),
    AUTHENTICATED("authenticated"),
    CONNECTED("ready"),
    AUTH_FAILED("auth_failed"),
    /** Terminal until an operator action. */
    AUTH_FAILED_MAX_RETRIES("auth_failed_max_retries"),
    /** Terminal until an operator action. */
    RECONNECT_FAILED("reconnect_failed"),
    LOGGED_OUT("logged_out");

    private final String id;

    ConnectionState(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public boolean isTerminal() {
        return this == AUTH_FAILED_MAX_RETRIES || this == RECONNECT_FAILED;
    }
}
