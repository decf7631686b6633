package com.replybot.app.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of single-thread executors. Work for one key always runs on the
 * same lane, in submission order; different keys may run concurrently.
 */
@Slf4j
public class SenderLanes {

    private final ExecutorService[] lanes;

    public SenderLanes(int count) {
        int size = Math.max(1, count);
        this.lanes = new ExecutorService[size];
        for (int i = 0; i < size; i++) {
            String name = "replybot-lane-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    /**
     * Queue {@code task} on the lane of {@code key}. The returned future
     * completes when the task has run; a task failure is logged and also
     * completes the future exceptionally.
     *
     * @throws java.util.concurrent.RejectedExecutionException after {@link #shutdown}
     */
    public CompletableFuture<Void> submit(String key, Runnable task) {
        return CompletableFuture.runAsync(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[pipeline] Task for {} failed", key, e);
                throw e;
            }
        }, lanes[laneFor(key)]);
    }

    int laneFor(String key) {
        return key == null ? 0 : Math.floorMod(key.hashCode(), lanes.length);
    }

    public int size() {
        return lanes.length;
    }

    /**
     * Stop accepting work and wait up to {@code grace} for queued tasks.
     */
    public void shutdown(Duration grace) {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        long deadline = System.nanoTime() + grace.toNanos();
        try {
            for (ExecutorService lane : lanes) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0 || !lane.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    lane.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (ExecutorService lane : lanes) {
                lane.shutdownNow();
            }
        }
    }
}
