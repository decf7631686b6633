package com.replybot.analytics;

import com.replybot.analytics.errors.ErrorLogEntry;
import com.replybot.analytics.model.ContactStat;
import com.replybot.analytics.model.DailyStat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializable copy of the aggregator state, used for periodic persistence
 * and restore on startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsSnapshot {
    private Instant takenAt;
    @Builder.Default
    private List<DailyStat> dailyStats = new ArrayList<>();
    @Builder.Default
    private long[] hourlyDistribution = new long[24];
    @Builder.Default
    private List<ContactStat> contacts = new ArrayList<>();
    @Builder.Default
    private List<ErrorLogEntry> errorLog = new ArrayList<>();
}
