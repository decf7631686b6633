package com.replybot.common.config;

import lombok.Data;

/**
 * Root configuration type for ReplyBot.
 * Loaded from {@code replybot.json} by {@link ConfigService}.
 */
@Data
public class ReplyBotConfig {

    /** Directory for persisted messages, settings and analytics. */
    private String dataPath;

    /** Persistence settings. */
    private PersistenceConfig persistence;

    /** Analytics rollup settings. */
    private AnalyticsConfig analytics;

    /** Transport connection supervision settings. */
    private ConnectionConfig connection;

    /** Pipeline execution settings. */
    private PipelineConfig pipeline;

    /** Operator-facing bot settings (auto-reply, lists, hours, LLM). */
    private BotSettings settings;

    // --- Nested config types ---

    @Data
    public static class PersistenceConfig {
        /** Write messages/settings/analytics to JSON files under dataPath. */
        private boolean enabled = false;
        /** Interval between periodic analytics snapshots. */
        private long snapshotIntervalMs = 5 * 60_000;
    }

    @Data
    public static class AnalyticsConfig {
        /** Zone used for daily keys and hour-of-day buckets. */
        private String zone = "UTC";
        private int errorLogCapacity = 1000;
        private int contactCapacity = 10_000;
    }

    @Data
    public static class ConnectionConfig {
        private int maxRetries = 3;
        private long authRetryDelayMs = 5_000;
        private long reconnectDelayMs = 10_000;
        private long restartDelayMs = 2_000;
    }

    @Data
    public static class PipelineConfig {
        /** Number of serial lanes; events of one sender always share a lane. */
        private int lanes = 4;
        /** Interval between rate-limit bucket purges. */
        private long rateLimitCleanupIntervalMs = 60 * 60_000;
        /** Upper bound on one transport send before it counts as failed. */
        private long sendTimeoutMs = 30_000;
    }
}
