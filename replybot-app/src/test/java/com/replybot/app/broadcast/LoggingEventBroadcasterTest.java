package com.replybot.app.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.replybot.channel.events.EventTopics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingEventBroadcasterTest {

    private final LoggingEventBroadcaster broadcaster =
            new LoggingEventBroadcaster(new ObjectMapper().registerModule(new JavaTimeModule()));

    @Test
    void everyEventGetsNextSequenceNumber() {
        broadcaster.emit(EventTopics.MESSAGE_NEW, Map.of("id", "m1", "timestamp", Instant.EPOCH));
        broadcaster.emit(EventTopics.BOT_STATUS, Map.of("state", "ready"));

        assertEquals(2, broadcaster.lastSeq());
    }

    @Test
    void unserializablePayloadIsDropped() {
        assertDoesNotThrow(() -> broadcaster.emit(EventTopics.MESSAGE_SENT, new Object()));
        assertEquals(1, broadcaster.lastSeq());
    }
}
