package com.replybot.analytics.model;

import com.replybot.analytics.errors.ErrorCategory;

import java.time.Instant;

/** Aggregated occurrences of one error category. */
public record ErrorStat(ErrorCategory type, long count, Instant lastOccurrence, boolean resolved) {
}
