package com.replybot.analytics.errors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Bounded FIFO of error entries; the oldest entry is dropped when full.
 * Not thread-safe; guarded by the owning aggregator.
 */
public class ErrorLog {

    private final int capacity;
    private final ArrayDeque<ErrorLogEntry> entries;

    public ErrorLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.entries = new ArrayDeque<>(Math.min(this.capacity, 1024));
    }

    public void add(ErrorLogEntry entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    public void addAll(Collection<ErrorLogEntry> restored) {
        restored.forEach(this::add);
    }

    /** Oldest first. */
    public List<ErrorLogEntry> entries() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }
}
