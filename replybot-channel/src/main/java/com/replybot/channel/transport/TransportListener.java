package com.replybot.channel.transport;

import com.replybot.channel.model.Message;

/**
 * Callbacks from a {@link ChatTransport}.
 * All methods default to no-ops so consumers override only what they need.
 */
public interface TransportListener {

    /** An inbound message arrived. */
    default void onMessage(Message message) {
    }

    /** Delivery ack for an outbound message (see {@code MessageStatus.fromAck}). */
    default void onAck(String messageId, int ack) {
    }

    /** A pairing QR code was issued. */
    default void onQr(String qr) {
    }

    default void onAuthenticated() {
    }

    /** Session is usable; {@code clientInfo} describes the logged-in account. */
    default void onReady(ChatTransport.ClientInfo clientInfo) {
    }

    default void onAuthFailure(String reason) {
    }

    default void onDisconnected(String reason) {
    }
}
