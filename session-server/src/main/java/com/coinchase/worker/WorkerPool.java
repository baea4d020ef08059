package com.coinchase.worker;

import com.coinchase.task.EventProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.IntFunction;

/**
 * Fixed-size registry of worker slots.
 *
 * Every slot is in exactly one of two indices, available or in use, so
 * available + in use == capacity after every operation. Membership is
 * guarded by the pool lock; slot status by each slot's own lock, always
 * taken after the pool lock. Nothing here waits on I/O.
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final List<Worker> workers;
    private final OwnerIndex owners;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<Integer, Worker> available = new LinkedHashMap<>();
    private final Map<Integer, Worker> inUse = new HashMap<>();

    public WorkerPool(List<Worker> workers, OwnerIndex owners) {
        this.workers = Collections.unmodifiableList(new ArrayList<>(workers));
        this.owners = owners;
        for (int i = 0; i < this.workers.size(); i++) {
            Worker worker = this.workers.get(i);
            if (worker.getId() != i) {
                throw new IllegalArgumentException("Worker at index " + i + " has id " + worker.getId());
            }
            available.put(i, worker);
        }
    }

    /**
     * Creates {@code capacity} slots sharing one owner index and processor pool.
     */
    public static WorkerPool create(int capacity, IntFunction<SessionReceiver> receivers, EventProcessor processors) {
        OwnerIndex owners = new OwnerIndex();
        List<Worker> workers = new ArrayList<>(capacity);
        for (int id = 0; id < capacity; id++) {
            workers.add(new Worker(id, receivers.apply(id), processors, owners));
        }
        return new WorkerPool(workers, owners);
    }

    /**
     * Arms every slot. Completes once every listening port is bound.
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<?>[] bound = new CompletableFuture<?>[workers.size()];
        for (int i = 0; i < workers.size(); i++) {
            bound[i] = workers.get(i).start();
        }
        return CompletableFuture.allOf(bound);
    }

    public void setSendRoutine(SendRoutine sendRoutine) {
        for (Worker worker : workers) {
            worker.setSendRoutine(sendRoutine);
        }
    }

    /**
     * Hands out an AVAILABLE slot, now PULLED_OUT. Never blocks.
     *
     * @throws WorkerCapacityException if no slot is available
     */
    public Worker pull() {
        lock.lock();
        try {
            for (Worker worker : available.values()) {
                if (worker.pullOut()) {
                    available.remove(worker.getId());
                    inUse.put(worker.getId(), worker);
                    logger.debug("Worker {} pulled out ({} left)", worker.getId(), available.size());
                    return worker;
                }
            }
        } finally {
            lock.unlock();
        }
        throw new WorkerCapacityException(workers.size());
    }

    /**
     * Returns a slot to the pool, ending its session. Putting an
     * AVAILABLE slot is a no-op.
     */
    public void put(int id, Worker worker) {
        if (id < 0 || id >= workers.size() || workers.get(id) != worker) {
            throw new IllegalArgumentException("Worker " + id + " does not belong to this pool");
        }

        lock.lock();
        try {
            if (worker.recycle("returned to pool")) {
                inUse.remove(id);
                available.put(id, worker);
                logger.debug("Worker {} put back ({} available)", id, available.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reclaims a slot whose session is dead or stuck: force-exits it and puts
     * it back. Does nothing if the slot moved on to another session since
     * {@code observed} was read.
     *
     * @return true if the slot was reclaimed
     */
    public boolean revive(Worker worker, SessionTermination observed, String reason) {
        lock.lock();
        try {
            if (worker.getTermination() != observed) {
                return false;
            }
            worker.forceExit(reason);
            put(worker.getId(), worker);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws WorkerNotFoundException if the user has no slot
     */
    public Worker getByUserId(String userId) {
        Integer id = owners.find(userId);
        if (id != null) {
            Worker worker = workers.get(id);
            if (userId.equals(worker.getOwnerUserId())) {
                return worker;
            }
        }
        throw new WorkerNotFoundException(userId);
    }

    public boolean isConnected(String userId) {
        return owners.find(userId) != null;
    }

    public int getAvailableWorkerCount() {
        lock.lock();
        try {
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveWorkerCount() {
        lock.lock();
        try {
            return inUse.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return workers.size();
    }

    public List<Worker> getWorkers() {
        return workers;
    }

    public void shutdown() {
        lock.lock();
        try {
            for (Worker worker : workers) {
                worker.shutdown();
            }
        } finally {
            lock.unlock();
        }
    }
}
