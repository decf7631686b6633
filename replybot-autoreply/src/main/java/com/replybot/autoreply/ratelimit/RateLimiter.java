package com.replybot.autoreply.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.IntSupplier;

/**
 * Per-sender hourly budget for generated replies.
 * <p>
 * Buckets are keyed by sender and epoch hour, so the same hour of day on
 * different days never shares a count. The window is the wall-clock hour, not
 * a sliding hour: a sender can get up to twice the limit in a short span
 * around an hour boundary.
 * <p>
 * Only successful generations are {@linkplain #record recorded}; fallbacks
 * do not consume budget.
 */
@Slf4j
public class RateLimiter {

    private static final long HOUR_MS = 3_600_000L;

    private record BucketKey(String senderId, long epochHour) {
    }

    private final Clock clock;
    private final IntSupplier limitPerHour;
    private final Map<BucketKey, Integer> buckets = new HashMap<>();

    /**
     * @param limitPerHour read on every check so settings changes apply
     *                     immediately
     */
    public RateLimiter(Clock clock, IntSupplier limitPerHour) {
        this.clock = clock;
        this.limitPerHour = limitPerHour;
    }

    /**
     * Whether {@code senderId} still has budget this hour. Never mutates.
     */
    public synchronized boolean allow(String senderId) {
        int count = buckets.getOrDefault(key(senderId), 0);
        return count < limitPerHour.getAsInt();
    }

    /**
     * Charge one request to the current bucket.
     */
    public synchronized void record(String senderId) {
        buckets.merge(key(senderId), 1, Integer::sum);
    }

    /** Requests recorded for {@code senderId} in the current hour. */
    public synchronized int count(String senderId) {
        return buckets.getOrDefault(key(senderId), 0);
    }

    /**
     * Drop buckets that do not belong to the current hour.
     *
     * @return number of buckets removed
     */
    public synchronized int cleanup() {
        long currentHour = currentHour();
        int removed = 0;
        Iterator<BucketKey> it = buckets.keySet().iterator();
        while (it.hasNext()) {
            if (it.next().epochHour() != currentHour) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Rate limiter cleanup removed {} stale buckets", removed);
        }
        return removed;
    }

    public synchronized void reset() {
        buckets.clear();
    }

    /** Number of live buckets. */
    public synchronized int size() {
        return buckets.size();
    }

    private BucketKey key(String senderId) {
        return new BucketKey(senderId, currentHour());
    }

    private long currentHour() {
        return Math.floorDiv(clock.millis(), HOUR_MS);
    }
}
