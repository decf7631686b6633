package com.replybot.channel.testing;

import com.replybot.channel.events.EventBroadcaster;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects emitted events for assertions.
 */
public class RecordingBroadcaster implements EventBroadcaster {

    public record Event(String topic, Object payload) {
    }

    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized void emit(String topic, Object payload) {
        events.add(new Event(topic, payload));
    }

    public synchronized List<Event> events() {
        return new ArrayList<>(events);
    }

    public synchronized List<Object> payloads(String topic) {
        return events.stream().filter(e -> e.topic().equals(topic)).map(Event::payload).toList();
    }
}
