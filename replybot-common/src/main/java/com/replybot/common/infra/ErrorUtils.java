package com.replybot.common.infra;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Strip {@link CompletionException}/{@link ExecutionException} wrappers
     * added by future composition.
     */
    public static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable cause = unwrap(err);
        String msg = cause.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return cause.getClass().getSimpleName();
    }
}
