package com.replybot.channel.events;

/**
 * Real-time event fan-out to connected operator clients.
 * Implementations must not throw back into the pipeline; delivery is
 * best-effort.
 */
public interface EventBroadcaster {

    void emit(String topic, Object payload);
}
