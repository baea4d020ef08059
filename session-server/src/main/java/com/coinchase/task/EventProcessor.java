package com.coinchase.task;

import com.coinchase.protocol.InboundEvent;
import com.coinchase.state.GameState;
import com.coinchase.worker.SessionTermination;
import com.coinchase.worker.Worker;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pool of processor tasks draining one shared queue of decoded events.
 *
 * There is one task per worker slot. A task is paired with its slot only
 * for liveness checks and shutdown: any task may apply any session's event.
 * Events from different sessions interleave freely; each event replaces the
 * user's latest state, so last write wins.
 *
 * Threading: tasks run on a cached pool so a replacement task can start
 * while a stuck one is still being interrupted.
 */
public class EventProcessor {

    private static final Logger logger = LoggerFactory.getLogger(EventProcessor.class);

    private final GameState gameState;
    private final BlockingQueue<InboundEvent> events;
    private final ExecutorService executor;

    public EventProcessor(GameState gameState, int queueCapacity) {
        this.gameState = gameState;
        this.events = new LinkedBlockingQueue<>(queueCapacity);
        this.executor = Executors.newCachedThreadPool(new DefaultThreadFactory("event-processor", true));
    }

    /**
     * Enqueues a decoded event. Called from receiver I/O threads, so it never
     * blocks: when the queue is full the event is dropped, since a newer one
     * from the same user will replace it anyway.
     */
    public void submit(InboundEvent event) {
        if (!events.offer(event)) {
            logger.warn("Event queue full, dropping {}", event);
        }
    }

    /**
     * Starts the processor task paired with {@code worker} for one session.
     */
    public ProcessorTask launch(Worker worker, SessionTermination termination) {
        ProcessorTask task = new ProcessorTask(worker, termination, events, gameState);
        executor.execute(task);
        return task;
    }

    public int getPendingEventCount() {
        return events.size();
    }

    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Processor tasks did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
