package com.replybot.channel.transport;

/**
 * Thrown when a send is attempted while the transport session is not ready.
 */
public class TransportNotReadyException extends RuntimeException {

    public TransportNotReadyException(String message) {
        super(message);
    }
}
