package com.coinchase.worker;

import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Request/echo pair for one monitored task. The monitor calls {@link #ping()}
 * and waits on the future; the task calls {@link #echo()} from its loop.
 * A task that is stuck or gone never echoes, and the future times out.
 */
public class LivenessProbe {

    private final Queue<CompletableFuture<Void>> pending = new ConcurrentLinkedQueue<>();

    public CompletableFuture<Void> ping() {
        CompletableFuture<Void> echo = new CompletableFuture<>();
        pending.add(echo);
        return echo;
    }

    public void echo() {
        CompletableFuture<Void> echo;
        while ((echo = pending.poll()) != null) {
            echo.complete(null);
        }
    }

    /**
     * Fails outstanding pings, used when the task exits.
     */
    public void fail(Throwable cause) {
        CompletableFuture<Void> echo;
        while ((echo = pending.poll()) != null) {
            echo.completeExceptionally(cause);
        }
    }
}
