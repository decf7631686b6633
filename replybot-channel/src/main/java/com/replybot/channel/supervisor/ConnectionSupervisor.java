package com.replybot.channel.supervisor;

import com.replybot.channel.events.EventBroadcaster;
import com.replybot.channel.events.EventTopics;
import com.replybot.channel.model.Message;
import com.replybot.channel.transport.ChatTransport;
import com.replybot.channel.transport.ChatTransportFactory;
import com.replybot.channel.transport.PhoneNumbers;
import com.replybot.channel.transport.TransportListener;
import com.replybot.channel.transport.TransportNotReadyException;
import com.replybot.common.config.ReplyBotConfig;
import com.replybot.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the chat transport session and drives its lifecycle.
 * <p>
 * Auth failures rebuild the transport after {@code authRetryDelayMs};
 * disconnects reconnect after {@code reconnectDelayMs}. Both share one retry
 * counter, capped at {@code maxRetries} and reset when the session becomes
 * ready or an operator acts. Exhausting the cap parks the supervisor in a
 * terminal state ({@link ConnectionState#AUTH_FAILED_MAX_RETRIES} or
 * {@link ConnectionState#RECONNECT_FAILED}) until {@link #reconnect()} or
 * {@link #restart()}.
 * <p>
 * Each transport instance is tagged with a generation; callbacks from a
 * transport that has since been replaced are ignored.
 */
@Slf4j
public class ConnectionSupervisor {

    private final ChatTransportFactory transportFactory;
    private final ReplyBotConfig.ConnectionConfig config;
    private final ScheduledExecutorService scheduler;
    private final EventBroadcaster broadcaster;
    private final Clock clock;

    private final Object lock = new Object();
    private final AtomicReference<ScheduledFuture<?>> pendingAction = new AtomicReference<>();
    private volatile TransportListener downstream = new TransportListener() {
    };

    // ── State (guarded by lock) ─────────────────────────────────────────

    private ChatTransport transport;
    private long generation;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ChatTransport.ClientInfo clientInfo;
    private String qrCode;
    private int retryCount;

    public ConnectionSupervisor(ChatTransportFactory transportFactory,
            ReplyBotConfig.ConnectionConfig config,
            ScheduledExecutorService scheduler,
            EventBroadcaster broadcaster) {
        this(transportFactory, config, scheduler, broadcaster, Clock.systemUTC());
    }

    public ConnectionSupervisor(ChatTransportFactory transportFactory,
            ReplyBotConfig.ConnectionConfig config,
            ScheduledExecutorService scheduler,
            EventBroadcaster broadcaster,
            Clock clock) {
        this.transportFactory = transportFactory;
        this.config = config;
        this.scheduler = scheduler;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    /**
     * Open the first session. Inbound messages and acks are forwarded to
     * {@code listener}.
     */
    public void start(TransportListener listener) {
        this.downstream = listener;
        cancelPending();
        synchronized (lock) {
            retryCount = 0;
        }
        openSession("start");
    }

    /**
     * Tear down the session without changing the retry counter. Used on
     * application shutdown.
     */
    public void stop() {
        cancelPending();
        destroyCurrent();
        transition(ConnectionState.DISCONNECTED);
        log.info("[supervisor] Stopped");
    }

    // ── Operator actions ────────────────────────────────────────────────

    public void reconnect() {
        log.info("[supervisor] Manual reconnect requested");
        cancelPending();
        synchronized (lock) {
            retryCount = 0;
        }
        openSession("reconnect");
    }

    public void disconnect() {
        log.info("[supervisor] Manual disconnect requested");
        cancelPending();
        synchronized (lock) {
            retryCount = 0;
        }
        destroyCurrent();
        transition(ConnectionState.DISCONNECTED);
    }

    /**
     * Unlink the account. The next session starts with a fresh QR pairing.
     */
    public void logout() {
        log.info("[supervisor] Logout requested");
        cancelPending();
        ChatTransport current;
        synchronized (lock) {
            retryCount = 0;
            current = transport;
            transport = null;
            generation++;
        }
        try {
            if (current != null) {
                current.logout();
            }
        } finally {
            destroyQuietly(current);
            transition(ConnectionState.LOGGED_OUT);
        }
    }

    /**
     * Disconnect, then open a new session after {@code restartDelayMs}.
     */
    public void restart() {
        log.info("[supervisor] Restart requested");
        cancelPending();
        synchronized (lock) {
            retryCount = 0;
        }
        destroyCurrent();
        transition(ConnectionState.DISCONNECTED);
        schedule("restart", () -> openSession("restart"), config.getRestartDelayMs());
    }

    // ── Queries ─────────────────────────────────────────────────────────

    public boolean isReady() {
        synchronized (lock) {
            return state == ConnectionState.CONNECTED && transport != null;
        }
    }

    public StatusSnapshot getStatus() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /**
     * Send through the current session.
     *
     * @param recipient free-form phone number or chat id
     * @throws TransportNotReadyException when the session is not ready
     */
    public CompletableFuture<ChatTransport.SentMessage> send(String recipient, String content,
            ChatTransport.SendOptions options) {
        ChatTransport current;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTED || transport == null) {
                throw new TransportNotReadyException("Transport is not ready (state: " + state.getId() + ")");
            }
            current = transport;
        }
        return current.send(PhoneNumbers.toChatId(recipient), content, options);
    }

    // ── Session management ──────────────────────────────────────────────

    private void openSession(String reason) {
        destroyCurrent();
        long gen;
        synchronized (lock) {
            gen = ++generation;
            state = ConnectionState.INITIALIZING;
            clientInfo = null;
            qrCode = null;
        }
        publishStatus();
        log.info("[supervisor] Opening transport session ({})", reason);

        ChatTransport created = null;
        try {
            created = transportFactory.create();
            boolean current;
            synchronized (lock) {
                current = gen == generation;
                if (current) {
                    transport = created;
                }
            }
            if (!current) {
                destroyQuietly(created);
                return;
            }
            created.connect(new SessionListener(gen));
        } catch (RuntimeException e) {
            log.warn("[supervisor] Failed to open transport session: {}", ErrorUtils.formatErrorMessage(e));
            handleDisconnected(gen, ErrorUtils.formatErrorMessage(e));
        }
    }

    private void destroyCurrent() {
        ChatTransport current;
        synchronized (lock) {
            current = transport;
            transport = null;
            generation++;
            clientInfo = null;
            qrCode = null;
        }
        destroyQuietly(current);
    }

    private void destroyQuietly(ChatTransport t) {
        if (t == null) {
            return;
        }
        try {
            t.destroy();
        } catch (RuntimeException e) {
            log.warn("[supervisor] Error destroying transport {}: {}", t.getId(), e.getMessage());
        }
    }

    // ── Transport events ────────────────────────────────────────────────

    private void handleQr(long gen, String qr) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = ConnectionState.QR_PENDING;
            qrCode = qr;
        }
        log.info("[supervisor] QR code received, waiting for pairing");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("qr", qr);
        payload.put("timestamp", Instant.now(clock));
        emit(EventTopics.BOT_QR, payload);
        publishStatus();
    }

    private void handleAuthenticated(long gen) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = ConnectionState.AUTHENTICATED;
            qrCode = null;
        }
        log.info("[supervisor] Authenticated");
        publishStatus();
    }

    private void handleReady(long gen, ChatTransport.ClientInfo info) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            state = ConnectionState.CONNECTED;
            retryCount = 0;
            qrCode = null;
            clientInfo = info;
        }
        log.info("[supervisor] Session ready{}", info != null && info.getPushName() != null
                ? " as " + info.getPushName() : "");
        emit(EventTopics.BOT_READY, info);
        publishStatus();
    }

    private void handleAuthFailure(long gen, String reason) {
        boolean retry;
        int attempt;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            retryCount++;
            attempt = retryCount;
            retry = retryCount < config.getMaxRetries();
            state = retry ? ConnectionState.AUTH_FAILED : ConnectionState.AUTH_FAILED_MAX_RETRIES;
            clientInfo = null;
        }
        publishStatus();
        if (retry) {
            long delay = config.getAuthRetryDelayMs();
            log.warn("[supervisor] Authentication failed ({}), retry {}/{} in {}ms",
                    reason, attempt, config.getMaxRetries(), delay);
            schedule("auth retry", () -> openSession("auth retry " + attempt), delay);
        } else {
            log.error("[supervisor] Authentication failed {} times, giving up: {}", attempt, reason);
            destroyCurrent();
        }
    }

    private void handleDisconnected(long gen, String reason) {
        boolean retry;
        int attempt;
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            clientInfo = null;
            qrCode = null;
            retry = retryCount < config.getMaxRetries();
            if (retry) {
                retryCount++;
            }
            attempt = retryCount;
            state = retry ? ConnectionState.DISCONNECTED : ConnectionState.RECONNECT_FAILED;
        }
        publishStatus();
        if (retry) {
            long delay = config.getReconnectDelayMs();
            log.warn("[supervisor] Disconnected ({}), reconnect {}/{} in {}ms",
                    reason, attempt, config.getMaxRetries(), delay);
            schedule("reconnect", () -> openSession("reconnect " + attempt), delay);
        } else {
            log.error("[supervisor] Disconnected ({}), reconnect attempts exhausted", reason);
            destroyCurrent();
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private void schedule(String what, Runnable task, long delayMs) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[supervisor] Scheduled {} failed", what, e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pendingAction.getAndSet(future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    private void cancelPending() {
        ScheduledFuture<?> future = pendingAction.getAndSet(null);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void transition(ConnectionState next) {
        synchronized (lock) {
            state = next;
        }
        publishStatus();
    }

    private void publishStatus() {
        StatusSnapshot snapshot;
        synchronized (lock) {
            snapshot = snapshotLocked();
        }
        emit(EventTopics.BOT_STATUS, snapshot);
    }

    private StatusSnapshot snapshotLocked() {
        return new StatusSnapshot(
                state,
                state == ConnectionState.CONNECTED,
                clientInfo,
                qrCode,
                retryCount,
                config.getMaxRetries(),
                Instant.now(clock));
    }

    private void emit(String topic, Object payload) {
        try {
            broadcaster.emit(topic, payload);
        } catch (RuntimeException e) {
            log.warn("[supervisor] Broadcast of {} failed: {}", topic, e.getMessage());
        }
    }

    /**
     * Binds callbacks to the transport generation they were issued for.
     */
    private final class SessionListener implements TransportListener {

        private final long gen;

        SessionListener(long gen) {
            this.gen = gen;
        }

        private boolean isCurrent() {
            synchronized (lock) {
                return gen == generation;
            }
        }

        @Override
        public void onMessage(Message message) {
            if (isCurrent()) {
                downstream.onMessage(message);
            }
        }

        @Override
        public void onAck(String messageId, int ack) {
            if (isCurrent()) {
                downstream.onAck(messageId, ack);
            }
        }

        @Override
        public void onQr(String qr) {
            handleQr(gen, qr);
        }

        @Override
        public void onAuthenticated() {
            handleAuthenticated(gen);
        }

        @Override
        public void onReady(ChatTransport.ClientInfo info) {
            handleReady(gen, info);
        }

        @Override
        public void onAuthFailure(String reason) {
            handleAuthFailure(gen, reason);
        }

        @Override
        public void onDisconnected(String reason) {
            handleDisconnected(gen, reason);
        }
    }
}
