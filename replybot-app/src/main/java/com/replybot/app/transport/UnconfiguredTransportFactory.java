package com.replybot.app.transport;

import com.replybot.channel.transport.ChatTransport;
import com.replybot.channel.transport.ChatTransportFactory;
import com.replybot.channel.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder used when no chat transport bean is provided. Every session
 * reports a disconnect right away, so the supervisor runs out of retries and
 * parks in its reconnect-failed state.
 */
@Slf4j
public class UnconfiguredTransportFactory implements ChatTransportFactory {

    static final String REASON = "no chat transport configured";

    @Override
    public ChatTransport create() {
        return new ChatTransport() {
            @Override
            public String getId() {
                return "unconfigured";
            }

            @Override
            public void connect(TransportListener listener) {
                log.warn("[transport] {}", REASON);
                listener.onDisconnected(REASON);
            }

            @Override
            public void destroy() {
            }

            @Override
            public void logout() {
            }

            @Override
            public CompletableFuture<SentMessage> send(String chatId, String content, SendOptions options) {
                return CompletableFuture.failedFuture(new IllegalStateException(REASON));
            }

            @Override
            public ClientInfo getClientInfo() {
                return null;
            }
        };
    }
}
