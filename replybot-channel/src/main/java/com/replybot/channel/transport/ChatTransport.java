package com.replybot.channel.transport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A chat protocol client (one login session).
 * <p>
 * Instances are single-use: after {@link #destroy()} a fresh client is
 * obtained from {@link ChatTransportFactory}. Lifecycle and message events
 * are reported to the listener passed to {@link #connect(TransportListener)}.
 */
public interface ChatTransport {

    /** Transport identifier (e.g. "whatsapp-web"). */
    String getId();

    /**
     * Start the session. Returns once the connection attempt is under way;
     * progress is reported through the listener.
     */
    void connect(TransportListener listener);

    /** Tear down the session and release resources. Safe to call twice. */
    void destroy();

    /** Unlink the account so the next session needs a fresh QR pairing. */
    void logout();

    /**
     * Send a message to a normalized chat id ({@code digits@c.us} or a group id).
     */
    CompletableFuture<SentMessage> send(String chatId, String content, SendOptions options);

    /** Account info, or {@code null} before the session is ready. */
    ClientInfo getClientInfo();

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class SendOptions {
        /** Transport id of the message being replied to. */
        private String quotedMessageId;
        private String mediaPath;
        private String caption;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class SentMessage {
        private String id;
        private String chatId;
        private Instant timestamp;
        private int ack;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ClientInfo {
        private String wid;
        private String pushName;
        private String platform;
        private String phoneNumber;
    }
}
