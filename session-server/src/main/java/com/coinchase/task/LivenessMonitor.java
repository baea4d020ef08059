package com.coinchase.task;

import com.coinchase.worker.SessionTermination;
import com.coinchase.worker.Worker;
import com.coinchase.worker.WorkerPool;
import com.coinchase.worker.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes every in-use slot and reclaims the dead ones.
 *
 * Each check pings the receiver and processor of every slot that is not
 * AVAILABLE, all at once, and waits at most the probe timeout for the echoes.
 * A slot found TERMINATED, or one that does not echo in time, is force-exited
 * and put back to the pool, which re-arms it with a fresh listener and
 * processor.
 */
public class LivenessMonitor {

    private static final Logger logger = LoggerFactory.getLogger(LivenessMonitor.class);

    private final WorkerPool pool;
    private final ScheduledExecutorService scheduler;
    private final long intervalMillis;
    private final long probeTimeoutMillis;

    private ScheduledFuture<?> checking;

    public LivenessMonitor(WorkerPool pool, ScheduledExecutorService scheduler,
                           long intervalMillis, long probeTimeoutMillis) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.intervalMillis = intervalMillis;
        this.probeTimeoutMillis = probeTimeoutMillis;
    }

    /**
     * Startup invariant: the pool holds exactly {@code expected} AVAILABLE slots.
     *
     * @throws IllegalStateException on mismatch; the process must not start
     */
    public static void verifyInitialCapacity(WorkerPool pool, int expected) {
        int availableCount = pool.getAvailableWorkerCount();
        long availableStatus = pool.getWorkers().stream()
                .filter(worker -> worker.getStatus() == WorkerStatus.AVAILABLE)
                .count();
        if (pool.getCapacity() != expected || availableCount != expected || availableStatus != expected) {
            throw new IllegalStateException(String.format(
                    "worker pool initialization failed. initialized count: %d, available: %d, expected count: %d",
                    pool.getCapacity(), availableCount, expected));
        }
    }

    public synchronized void start() {
        if (checking == null) {
            checking = scheduler.scheduleWithFixedDelay(
                    this::runCheck, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            logger.info("Liveness monitor checking every {}ms (probe timeout {}ms)", intervalMillis, probeTimeoutMillis);
        }
    }

    public synchronized void stop() {
        if (checking != null) {
            checking.cancel(false);
            checking = null;
        }
    }

    /**
     * Runs one check. Blocks at most the probe timeout.
     *
     * @return the number of slots reclaimed
     */
    public int checkAndRevive() {
        int revived = 0;
        Map<Worker, SessionTermination> probedSessions = new LinkedHashMap<>();
        Map<Worker, CompletableFuture<Void>> probes = new LinkedHashMap<>();

        for (Worker worker : pool.getWorkers()) {
            SessionTermination session = worker.getTermination();
            WorkerStatus status = worker.getStatus();

            if (status == WorkerStatus.TERMINATED) {
                if (pool.revive(worker, session, "session terminated")) {
                    revived++;
                }
            } else if (status != WorkerStatus.AVAILABLE) {
                probedSessions.put(worker, session);
                probes.put(worker, worker.ping().orTimeout(probeTimeoutMillis, TimeUnit.MILLISECONDS));
            }
        }

        for (Map.Entry<Worker, CompletableFuture<Void>> probe : probes.entrySet()) {
            Worker worker = probe.getKey();
            try {
                probe.getValue().join();
            } catch (CompletionException | CancellationException e) {
                logger.warn("Worker {} failed its liveness check: {}", worker.getId(), rootMessage(e));
                if (pool.revive(worker, probedSessions.get(worker), "liveness check failed")) {
                    revived++;
                }
            }
        }

        if (revived > 0) {
            logger.info("Liveness check reclaimed {} worker(s); {} available", revived, pool.getAvailableWorkerCount());
        }
        return revived;
    }

    private void runCheck() {
        try {
            checkAndRevive();
        } catch (RuntimeException e) {
            // A failed round must not cancel the schedule.
            logger.error("Liveness check failed", e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.toString();
    }
}
