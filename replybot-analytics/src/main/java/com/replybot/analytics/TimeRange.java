package com.replybot.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/** Reporting windows ending at "now". */
public enum TimeRange {
    DAY("day", 1),
    WEEK("week", 7),
    MONTH("month", 30),
    QUARTER("quarter", 90);

    private final String id;
    private final int days;

    TimeRange(String id, int days) {
        this.id = id;
        this.days = days;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public Duration duration() {
        return Duration.ofDays(days);
    }

    /** Unknown or missing ids fall back to {@link #WEEK}. */
    @JsonCreator
    public static TimeRange fromId(String id) {
        if (id != null) {
            for (TimeRange r : values()) {
                if (r.id.equalsIgnoreCase(id.trim())) {
                    return r;
                }
            }
        }
        return WEEK;
    }
}
