package com.replybot.channel.transport;

/**
 * Creates fresh {@link ChatTransport} instances; called on first start and on
 * every rebuild after an auth failure, reconnect or restart.
 */
@FunctionalInterface
public interface ChatTransportFactory {

    ChatTransport create();
}
