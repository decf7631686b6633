package com.replybot.app.pipeline;

import com.replybot.channel.model.Message;

/**
 * An outbound message could not be sent. Carries the failed message as it was
 * persisted.
 */
public class MessageSendException extends RuntimeException {

    private final transient Message failedMessage;

    public MessageSendException(String message, Throwable cause, Message failedMessage) {
        super(message, cause);
        this.failedMessage = failedMessage;
    }

    public Message getFailedMessage() {
        return failedMessage;
    }
}
