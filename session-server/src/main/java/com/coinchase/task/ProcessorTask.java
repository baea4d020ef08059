package com.coinchase.task;

import com.coinchase.protocol.InboundEvent;
import com.coinchase.state.GameState;
import com.coinchase.worker.LivenessProbe;
import com.coinchase.worker.SessionTermination;
import com.coinchase.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One processor of the pool, paired with one worker's session.
 *
 * It only sees two plain flags rather than the session itself: a
 * termination flag (finish, mark the slot TERMINATED, exit) and a
 * force-exit flag (abort as a failure). Both are raised by the worker when
 * the session terminates.
 */
public class ProcessorTask implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorTask.class);

    static final long POLL_INTERVAL_MILLIS = 50;

    private final Worker worker;
    private final SessionTermination termination;
    private final BlockingQueue<InboundEvent> events;
    private final GameState gameState;
    private final LivenessProbe probe = new LivenessProbe();

    private final AtomicBoolean terminationSignal = new AtomicBoolean();
    private final AtomicBoolean forceExitSignal = new AtomicBoolean();
    private volatile boolean exited;

    // Guarded by this
    private Thread runner;

    ProcessorTask(Worker worker, SessionTermination termination,
                  BlockingQueue<InboundEvent> events, GameState gameState) {
        this.worker = worker;
        this.termination = termination;
        this.events = events;
        this.gameState = gameState;
    }

    @Override
    public void run() {
        synchronized (this) {
            runner = Thread.currentThread();
        }
        logger.debug("Processor for worker {} started", worker.getId());
        try {
            process();
        } catch (SessionAbortedException e) {
            logger.error("Processor for worker {} aborted: {}", worker.getId(), e.getMessage());
            termination.forceExit(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (forceExitSignal.get()) {
                logger.error("Processor for worker {} aborted while waiting", worker.getId());
            }
            termination.terminate("processor interrupted");
        } catch (RuntimeException e) {
            logger.error("Processor for worker {} failed", worker.getId(), e);
            termination.terminate("processor failed", e);
        } finally {
            synchronized (this) {
                runner = null;
            }
            exited = true;
            probe.fail(new IllegalStateException("processor for worker " + worker.getId() + " exited"));
            worker.markTerminated(termination);
        }
    }

    private void process() throws InterruptedException {
        while (true) {
            probe.echo();

            if (forceExitSignal.get()) {
                throw new SessionAbortedException("forced exit of worker " + worker.getId()
                        + ": " + termination.getReason());
            }
            if (terminationSignal.get()) {
                logger.debug("Processor for worker {} received termination", worker.getId());
                return;
            }

            InboundEvent event = events.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            if (event != null) {
                apply(event);
            }
        }
    }

    private void apply(InboundEvent event) {
        try {
            event.applyTo(gameState);
        } catch (RuntimeException e) {
            logger.warn("Dropping {} after it failed to apply: {}", event, e.toString());
        }
    }

    /**
     * Raises the termination flag, or the force-exit flag when {@code forced}.
     * A forced exit also interrupts the task in case it is stuck.
     */
    public void signalTermination(boolean forced) {
        if (forced) {
            forceExitSignal.set(true);
            synchronized (this) {
                if (runner != null) {
                    runner.interrupt();
                }
            }
        } else {
            terminationSignal.set(true);
        }
    }

    public CompletableFuture<Void> ping() {
        if (exited) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("processor for worker " + worker.getId() + " exited"));
        }
        return probe.ping();
    }
}
