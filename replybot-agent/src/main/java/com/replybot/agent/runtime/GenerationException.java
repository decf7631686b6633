package com.replybot.agent.runtime;

/**
 * Response generation failed; callers fall back to a static reply.
 */
public class GenerationException extends RuntimeException {

    public enum Reason {
        /** No reply within the configured timeout. */
        TIMEOUT,
        /** Generator disabled or its provider failed to initialize. */
        NOT_READY,
        /** Transport or API error from the provider. */
        PROVIDER_ERROR,
        /** Provider answered with blank text. */
        EMPTY_RESPONSE
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
