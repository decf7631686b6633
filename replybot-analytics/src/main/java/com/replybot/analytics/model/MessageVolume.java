package com.replybot.analytics.model;

/**
 * Message totals for a reporting period.
 *
 * @param trend percentage change of {@code total} against the previous period
 *              of equal length, rounded; 0 when the previous period was empty
 */
public record MessageVolume(long total, long sent, long received, long failed, long trend) {
}
