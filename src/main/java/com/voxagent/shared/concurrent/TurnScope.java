package com.voxagent.shared.concurrent;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Collects every future started on behalf of one user turn so the turn can be
 * cancelled as a unit. Futures tracked after {@link #cancel()} are cancelled on entry.
 */
public class TurnScope {

    private final Queue<CompletableFuture<?>> tracked = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelled;

    public <T> CompletableFuture<T> track(CompletableFuture<T> future) {
        tracked.add(future);
        if (cancelled) future.cancel(true);
        return future;
    }

    public void cancel() {
        cancelled = true;
        CompletableFuture<?> f;
        while ((f = tracked.poll()) != null) {
            f.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
