package com.replybot.autoreply.ratelimit;

import com.replybot.autoreply.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.at("2024-03-04T10:15:00Z");
    private final RateLimiter limiter = new RateLimiter(clock, () -> 3);

    @Test
    void allowsExactlyLimitPerHour() {
        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.allow("alice"));
            limiter.record("alice");
        }
        assertFalse(limiter.allow("alice"));
        assertEquals(3, limiter.count("alice"));
    }

    @Test
    void allowDoesNotMutate() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.allow("alice"));
        }
        assertEquals(0, limiter.count("alice"));
        assertEquals(0, limiter.size());
    }

    @Test
    void sendersAreIndependent() {
        for (int i = 0; i < 3; i++) {
            limiter.record("alice");
        }
        assertFalse(limiter.allow("alice"));
        assertTrue(limiter.allow("bob"));
    }

    @Test
    void nextHourStartsFresh() {
        for (int i = 0; i < 3; i++) {
            limiter.record("alice");
        }
        clock.set("2024-03-04T11:00:00Z");
        assertTrue(limiter.allow("alice"));
    }

    @Test
    void sameHourOfDayOnAnotherDay_doesNotShareBucket() {
        for (int i = 0; i < 3; i++) {
            limiter.record("alice");
        }
        clock.advance(Duration.ofDays(1));
        assertTrue(limiter.allow("alice"));
        assertEquals(0, limiter.count("alice"));
    }

    @Test
    void cleanup_purgesOtherHours() {
        limiter.record("alice");
        limiter.record("bob");
        clock.advance(Duration.ofHours(1));
        limiter.record("carol");

        assertEquals(2, limiter.cleanup());
        assertEquals(1, limiter.size());
        assertEquals(1, limiter.count("carol"));
    }

    @Test
    void limitChangesApplyImmediately() {
        int[] limit = {1};
        RateLimiter dynamic = new RateLimiter(clock, () -> limit[0]);
        dynamic.record("alice");
        assertFalse(dynamic.allow("alice"));

        limit[0] = 2;
        assertTrue(dynamic.allow("alice"));
    }

    @Test
    void reset_clearsEverything() {
        limiter.record("alice");
        limiter.reset();
        assertEquals(0, limiter.size());
    }
}
