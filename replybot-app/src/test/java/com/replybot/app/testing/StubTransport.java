package com.replybot.app.testing;

import com.replybot.channel.transport.ChatTransport;
import com.replybot.channel.transport.ChatTransportFactory;
import com.replybot.channel.transport.TransportListener;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory transport whose listener the test drives directly.
 */
public class StubTransport implements ChatTransport {

    public record Sent(String chatId, String content) {
    }

    private volatile TransportListener listener;
    private volatile boolean destroyed;
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();
    private final AtomicInteger hangsLeft = new AtomicInteger();
    private volatile Consumer<String> beforeReturn = id -> { };

    @Override
    public String getId() {
        return "stub";
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
    }

    @Override
    public CompletableFuture<SentMessage> send(String chatId, String content, SendOptions options) {
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return CompletableFuture.failedFuture(new IllegalStateException("Network error: socket closed"));
        }
        if (hangsLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return new CompletableFuture<>();
        }
        sent.add(new Sent(chatId, content));
        String id = "out-" + ids.incrementAndGet();
        beforeReturn.accept(id);
        return CompletableFuture.completedFuture(SentMessage.builder()
                .id(id)
                .chatId(chatId)
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

    public List<Sent> sent() {
        return sent;
    }

    /** Fail the next {@code count} sends. */
    public void failNextSends(int count) {
        failuresLeft.set(count);
    }

    /** Leave the futures of the next {@code count} sends incomplete. */
    public void hangNextSends(int count) {
        hangsLeft.set(count);
    }

    /** Run {@code hook} with the new message id before a successful send returns. */
    public void beforeSendReturns(Consumer<String> hook) {
        this.beforeReturn = hook;
    }

    public static class Factory implements ChatTransportFactory {

        private final List<StubTransport> created = new CopyOnWriteArrayList<>();

        @Override
        public ChatTransport create() {
            StubTransport t = new StubTransport();
            created.add(t);
            return t;
        }

        public StubTransport latest() {
            return created.get(created.size() - 1);
        }
    }
}
