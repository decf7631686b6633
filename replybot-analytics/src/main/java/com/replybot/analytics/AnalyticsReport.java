package com.replybot.analytics;

import com.replybot.analytics.model.ContactStat;
import com.replybot.analytics.model.DailyStat;
import com.replybot.analytics.model.ErrorStat;
import com.replybot.analytics.model.HourCount;
import com.replybot.analytics.model.MessageVolume;
import com.replybot.analytics.model.ResponseTimeStats;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard analytics for one {@link TimeRange}.
 */
public record AnalyticsReport(
        TimeRange range,
        Instant generatedAt,
        MessageVolume messageVolume,
        ResponseTimeStats responseTime,
        List<ContactStat> topContacts,
        List<HourCount> hourlyDistribution,
        List<DailyStat> dailyStats,
        List<ErrorStat> errorAnalysis) {
}
