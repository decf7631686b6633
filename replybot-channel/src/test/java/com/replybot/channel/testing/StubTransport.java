package com.replybot.channel.testing;

import com.replybot.channel.transport.ChatTransport;
import com.replybot.channel.transport.ChatTransportFactory;
import com.replybot.channel.transport.TransportListener;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport; tests drive its listener directly.
 */
public class StubTransport implements ChatTransport {

    public record Sent(String chatId, String content) {
    }

    private final int index;
    private volatile TransportListener listener;
    private volatile boolean destroyed;
    private volatile boolean loggedOut;
    private volatile RuntimeException sendFailure;
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();

    public StubTransport(int index) {
        this.index = index;
    }

    @Override
    public String getId() {
        return "stub-" + index;
    }

    @Override
    public void connect(TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void destroy() {
        destroyed = true;
    }

    @Override
    public void logout() {
        loggedOut = true;
    }

    @Override
    public CompletableFuture<SentMessage> send(String chatId, String content, SendOptions options) {
        if (sendFailure != null) {
            return CompletableFuture.failedFuture(sendFailure);
        }
        sent.add(new Sent(chatId, content));
        return CompletableFuture.completedFuture(SentMessage.builder()
                .id("out-" + ids.incrementAndGet())
                .chatId(chatId)
                .timestamp(Instant.now())
                .ack(1)
                .build());
    }

    @Override
    public ClientInfo getClientInfo() {
        return null;
    }

    public TransportListener listener() {
        return listener;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isLoggedOut() {
        return loggedOut;
    }

    public List<Sent> sent() {
        return sent;
    }

    public void failSendsWith(RuntimeException failure) {
        this.sendFailure = failure;
    }

    /**
     * Factory handing out numbered stubs and remembering each one.
     */
    public static class Factory implements ChatTransportFactory {

        private final List<StubTransport> created = new CopyOnWriteArrayList<>();

        @Override
        public ChatTransport create() {
            StubTransport t = new StubTransport(created.size() + 1);
            created.add(t);
            return t;
        }

        public int createdCount() {
            return created.size();
        }

        public StubTransport latest() {
            return created.get(created.size() - 1);
        }

        public List<StubTransport> all() {
            return new ArrayList<>(created);
        }
    }
}
