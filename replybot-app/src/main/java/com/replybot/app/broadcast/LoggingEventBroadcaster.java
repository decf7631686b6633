package com.replybot.app.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replybot.channel.events.EventBroadcaster;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default broadcaster when no real-time transport is wired: serializes each
 * event frame and writes it to the log at debug level.
 */
@Slf4j
public class LoggingEventBroadcaster implements EventBroadcaster {

    private final ObjectMapper mapper;
    private final AtomicLong seq = new AtomicLong(0);

    public LoggingEventBroadcaster(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void emit(String topic, Object payload) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "event");
        frame.put("event", topic);
        frame.put("payload", payload);
        frame.put("seq", seq.incrementAndGet());

        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            log.debug("[events] {}", mapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.warn("[events] Failed to serialize frame for {}: {}", topic, e.getOriginalMessage());
        }
    }

    public long lastSeq() {
        return seq.get();
    }
}
