package com.replybot.analytics.model;

/**
 * Response time summary in whole seconds; all zero when there were no
 * incoming/outgoing pairs.
 */
public record ResponseTimeStats(long average, long fastest, long slowest) {

    public static final ResponseTimeStats EMPTY = new ResponseTimeStats(0, 0, 0);
}
