package com.replybot.analytics.model;

/** Messages seen in one hour of the day (0-23). */
public record HourCount(int hour, long count) {
}
