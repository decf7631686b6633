package com.replybot.app.pipeline;

import com.replybot.agent.runtime.ResponseGenerator;
import com.replybot.analytics.AnalyticsAggregator;
import com.replybot.analytics.AnalyticsReport;
import com.replybot.analytics.AnalyticsSnapshot;
import com.replybot.analytics.TimeRange;
import com.replybot.app.store.MessageStore;
import com.replybot.autoreply.AutoReplyDecision;
import com.replybot.autoreply.AutoReplyGate;
import com.replybot.autoreply.AutoReplyRecord;
import com.replybot.autoreply.ratelimit.RateLimiter;
import com.replybot.channel.events.EventBroadcaster;
import com.replybot.channel.events.EventTopics;
import com.replybot.channel.model.Message;
import com.replybot.channel.model.MessageDirection;
import com.replybot.channel.model.MessageStatus;
import com.replybot.channel.supervisor.ConnectionSupervisor;
import com.replybot.channel.supervisor.StatusSnapshot;
import com.replybot.channel.transport.ChatTransport;
import com.replybot.channel.transport.PhoneNumbers;
import com.replybot.channel.transport.TransportListener;
import com.replybot.channel.transport.TransportNotReadyException;
import com.replybot.common.config.BotSettings;
import com.replybot.common.config.ConfigService;
import com.replybot.common.config.ReplyBotConfig;
import com.replybot.common.infra.ErrorUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires inbound traffic through persistence, analytics and the auto-reply
 * gate, and owns outbound sends.
 * <p>
 * Events for one sender run in order on that sender's lane, so a reply is
 * always handled after the message that triggered it. Persistence and
 * broadcast failures are logged and never stop the pipeline.
 * <p>
 * Acks run on the lane of their message id and can overtake the send that
 * produced the id; such acks are parked and applied when the sent message is
 * persisted.
 */
@Slf4j
public class PipelineOrchestrator implements TransportListener {

    static final String FAILURE_NOTICE =
            "Sorry, we could not process your message right now. Please try again later.";

    static final String SNAPSHOT_KIND = "snapshot";

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    static final int MAX_PENDING_ACKS = 1000;

    private record PendingAck(MessageStatus status, Instant at) {
    }

    private final ReplyBotConfig config;
    private final MessageStore store;
    private final EventBroadcaster broadcaster;
    private final ConnectionSupervisor supervisor;
    private final AutoReplyGate gate;
    private final ResponseGenerator generator;
    private final RateLimiter rateLimiter;
    private final AnalyticsAggregator analytics;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final SenderLanes lanes;

    private final AtomicReference<ScheduledFuture<?>> cleanupTask = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> snapshotTask = new AtomicReference<>();
    private volatile BotSettings settings = new BotSettings();

    /** Acks for ids not yet persisted, oldest evicted first. Guarded by itself. */
    private final Map<String, PendingAck> pendingAcks = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, PendingAck> eldest) {
            return size() > MAX_PENDING_ACKS;
        }
    };

    public PipelineOrchestrator(ReplyBotConfig config,
            MessageStore store,
            EventBroadcaster broadcaster,
            ConnectionSupervisor supervisor,
            AutoReplyGate gate,
            ResponseGenerator generator,
            RateLimiter rateLimiter,
            AnalyticsAggregator analytics,
            ScheduledExecutorService scheduler,
            Clock clock) {
        this.config = config;
        this.store = store;
        this.broadcaster = broadcaster;
        this.supervisor = supervisor;
        this.gate = gate;
        this.generator = generator;
        this.rateLimiter = rateLimiter;
        this.analytics = analytics;
        this.scheduler = scheduler;
        this.clock = clock;
        this.lanes = new SenderLanes(config.getPipeline().getLanes());
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Load settings (saved settings win over the config file), restore the
     * analytics snapshot, initialize the generator, start maintenance and
     * open the transport session.
     */
    @PostConstruct
    public void init() {
        BotSettings loaded = loadSettings();
        this.settings = loaded;

        try {
            store.loadAnalytics(SNAPSHOT_KIND, AnalyticsSnapshot.class).ifPresent(analytics::restore);
        } catch (RuntimeException e) {
            log.warn("[pipeline] Could not restore analytics: {}", ErrorUtils.formatErrorMessage(e));
        }

        generator.initialize(loaded.getLlm());
        scheduleMaintenance();
        supervisor.start(this);
        log.info("[pipeline] Started (autoReply={}, llm={}, lanes={})",
                loaded.isAutoReply(), generator.isReady(), lanes.size());
    }

    /**
     * Drain lanes, persist analytics and tear down the transport.
     */
    @PreDestroy
    public void cleanup() {
        cancel(cleanupTask);
        cancel(snapshotTask);
        lanes.shutdown(SHUTDOWN_GRACE);
        persistAnalytics();
        supervisor.stop();
        log.info("[pipeline] Stopped");
    }

    private BotSettings loadSettings() {
        try {
            var saved = store.getSettings();
            if (saved.isPresent()) {
                return ConfigService.applyDefaults(saved.get());
            }
        } catch (RuntimeException e) {
            log.warn("[pipeline] Could not read saved settings: {}", ErrorUtils.formatErrorMessage(e));
        }
        return ConfigService.applyDefaults(config.getSettings() != null ? config.getSettings() : new BotSettings());
    }

    private void scheduleMaintenance() {
        long cleanupMs = config.getPipeline().getRateLimitCleanupIntervalMs();
        cleanupTask.set(scheduler.scheduleAtFixedRate(this::cleanupRateLimits,
                cleanupMs, cleanupMs, TimeUnit.MILLISECONDS));

        long snapshotMs = config.getPersistence().getSnapshotIntervalMs();
        snapshotTask.set(scheduler.scheduleAtFixedRate(this::persistAnalytics,
                snapshotMs, snapshotMs, TimeUnit.MILLISECONDS));
    }

    void cleanupRateLimits() {
        int removed = rateLimiter.cleanup();
        if (removed > 0) {
            log.debug("[pipeline] Purged {} rate-limit buckets", removed);
        }
    }

    void persistAnalytics() {
        try {
            store.saveAnalytics(SNAPSHOT_KIND, analytics.snapshot());
        } catch (RuntimeException e) {
            log.warn("[pipeline] Failed to persist analytics: {}", ErrorUtils.formatErrorMessage(e));
        }
    }

    private static void cancel(AtomicReference<ScheduledFuture<?>> ref) {
        ScheduledFuture<?> task = ref.getAndSet(null);
        if (task != null) {
            task.cancel(false);
        }
    }

    // ── Transport callbacks ─────────────────────────────────────────────

    @Override
    public void onMessage(Message message) {
        dispatch(message.getSender(), () -> handleIncoming(message));
    }

    @Override
    public void onAck(String messageId, int ack) {
        dispatch(messageId, () -> handleAck(messageId, ack));
    }

    private CompletableFuture<Void> dispatch(String key, Runnable task) {
        try {
            return lanes.submit(key, task);
        } catch (RejectedExecutionException e) {
            log.warn("[pipeline] Dropping event for {}: pipeline is shut down", key);
            return CompletableFuture.completedFuture(null);
        }
    }

    void handleIncoming(Message message) {
        Message incoming = message.getTimestamp() != null
                ? message
                : message.toBuilder().timestamp(clock.instant()).build();

        quietly("persist message", () -> store.saveMessage(incoming));
        emit(EventTopics.MESSAGE_NEW, incoming);
        quietly("record analytics", () -> analytics.record(incoming));

        AutoReplyDecision decision = gate.evaluate(incoming, settings);
        if (decision.isReply()) {
            sendAutoReply(incoming, decision);
        }
    }

    void handleAck(String messageId, int ack) {
        MessageStatus status = MessageStatus.fromAck(ack);
        Instant now = clock.instant();
        synchronized (pendingAcks) {
            try {
                if (!store.updateMessageStatus(messageId, status, now)) {
                    pendingAcks.put(messageId, new PendingAck(status, now));
                    log.debug("[pipeline] Parked ack {} for unknown message {}", ack, messageId);
                }
            } catch (RuntimeException e) {
                log.warn("[pipeline] Failed to update status: {}", ErrorUtils.formatErrorMessage(e));
            }
        }
        emit(EventTopics.MESSAGE_STATUS, Map.of(
                "messageId", messageId,
                "status", status,
                "timestamp", now));
    }

    // ── Auto-reply ──────────────────────────────────────────────────────

    private void sendAutoReply(Message trigger, AutoReplyDecision decision) {
        String recipient = trigger.getSender();
        AutoReplyRecord.AutoReplyRecordBuilder record = AutoReplyRecord.builder()
                .sender(recipient)
                .senderName(trigger.getSenderName())
                .requestText(trigger.getContent())
                .responseText(decision.text())
                .responseType(decision.responseType())
                .group(trigger.isGroup())
                .workingHours(decision.isWorkingHours());

        boolean sent;
        try {
            sendMessage(recipient, decision.text(), null);
            record.sent(true);
            sent = true;
        } catch (MessageSendException e) {
            log.warn("[pipeline] Auto-reply to {} failed: {}", recipient, e.getMessage());
            record.sent(false).error(ErrorUtils.formatErrorMessage(e.getCause()));
            sent = false;
        }

        AutoReplyRecord saved = record.timestamp(clock.instant()).build();
        quietly("persist auto-reply", () -> store.saveAutoReply(saved));

        if (sent) {
            emit(EventTopics.AUTO_REPLY_SENT, saved);
            log.info("[pipeline] Auto-reply ({}) sent to {}", decision.responseType().getId(), recipient);
        } else {
            sendFailureNotice(recipient);
        }
    }

    private void sendFailureNotice(String recipient) {
        try {
            sendMessage(recipient, FAILURE_NOTICE, null);
        } catch (MessageSendException e) {
            log.warn("[pipeline] Failure notice to {} also failed: {}", recipient, e.getMessage());
        }
    }

    // ── Outbound ────────────────────────────────────────────────────────

    /**
     * Send {@code content} to {@code recipient} (phone number or chat id) and
     * record the outcome.
     *
     * @return the persisted outgoing message
     * @throws MessageSendException when the transport is not ready, refuses
     *                              the message or does not answer within the
     *                              send timeout; the failed message has been
     *                              persisted and counted by then
     */
    public Message sendMessage(String recipient, String content, ChatTransport.SendOptions options) {
        String chatId = normalizeQuietly(recipient);
        try {
            ChatTransport.SentMessage result = supervisor.send(recipient, content, options)
                    .orTimeout(config.getPipeline().getSendTimeoutMs(), TimeUnit.MILLISECONDS)
                    .join();
            Message sent = Message.builder()
                    .id(result.getId())
                    .sender(ownId())
                    .recipient(result.getChatId() != null ? result.getChatId() : chatId)
                    .content(content)
                    .direction(MessageDirection.OUTGOING)
                    .status(MessageStatus.SENT)
                    .timestamp(result.getTimestamp() != null ? result.getTimestamp() : clock.instant())
                    .chatId(result.getChatId() != null ? result.getChatId() : chatId)
                    .fromMe(true)
                    .hasMedia(options != null && options.getMediaPath() != null)
                    .mediaPath(options != null ? options.getMediaPath() : null)
                    .build();

            synchronized (pendingAcks) {
                PendingAck early = pendingAcks.remove(sent.getId());
                if (early != null) {
                    sent.setStatus(early.status());
                    sent.setStatusUpdatedAt(early.at());
                }
                quietly("persist message", () -> store.saveMessage(sent));
            }
            emit(EventTopics.MESSAGE_SENT, sent);
            quietly("record analytics", () -> analytics.record(sent));
            return sent;
        } catch (TransportNotReadyException | CompletionException | CancellationException
                | IllegalArgumentException e) {
            Throwable cause = ErrorUtils.unwrap(e);
            String error = ErrorUtils.formatErrorMessage(cause);
            Instant now = clock.instant();
            Message failed = Message.builder()
                    .id(Message.FAILED_ID_PREFIX + now.toEpochMilli())
                    .sender(ownId())
                    .recipient(chatId)
                    .content(content)
                    .direction(MessageDirection.OUTGOING)
                    .status(MessageStatus.FAILED)
                    .timestamp(now)
                    .chatId(chatId)
                    .fromMe(true)
                    .error(error)
                    .build();

            quietly("persist failed message", () -> store.saveMessage(failed));
            emit(EventTopics.MESSAGE_FAILED, failed);
            quietly("record analytics", () -> analytics.record(failed));
            throw new MessageSendException("Failed to send message to " + recipient + ": " + error, cause, failed);
        }
    }

    private String ownId() {
        StatusSnapshot status = supervisor.getStatus();
        return status.clientInfo() != null ? status.clientInfo().getWid() : null;
    }

    private static String normalizeQuietly(String recipient) {
        try {
            return PhoneNumbers.toChatId(recipient);
        } catch (IllegalArgumentException e) {
            return recipient;
        }
    }

    // ── Settings ────────────────────────────────────────────────────────

    /**
     * Persist and activate new operator settings. The generator is rebuilt
     * only when its connection settings changed.
     */
    public void applySettings(BotSettings next) {
        ConfigService.applyDefaults(next);
        store.saveSettings(next);
        this.settings = next;
        boolean ready = generator.updateSettings(next.getLlm());
        emit(EventTopics.SETTINGS_UPDATED, generator.getPublicSettings());
        log.info("[pipeline] Settings updated (autoReply={}, llm ready={})", next.isAutoReply(), ready);
    }

    public BotSettings getSettings() {
        return settings;
    }

    // ── Queries ─────────────────────────────────────────────────────────

    /**
     * Dashboard report for {@code range}; loads two windows of messages so the
     * trend can compare against the previous period.
     */
    public AnalyticsReport getAnalyticsReport(TimeRange range) {
        Instant now = clock.instant();
        List<Message> messages = store.getMessages(now.minus(range.duration().multipliedBy(2)), now.plusMillis(1));
        return analytics.report(messages, range, now);
    }

    public StatusSnapshot getStatus() {
        return supervisor.getStatus();
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private void emit(String topic, Object payload) {
        try {
            broadcaster.emit(topic, payload);
        } catch (RuntimeException e) {
            log.warn("[pipeline] Broadcast of {} failed: {}", topic, ErrorUtils.formatErrorMessage(e));
        }
    }

    private static void quietly(String action, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            log.warn("[pipeline] Failed to {}: {}", action, ErrorUtils.formatErrorMessage(e));
        }
    }
}
