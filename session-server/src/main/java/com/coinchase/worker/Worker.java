package com.coinchase.worker;

import com.coinchase.task.EventProcessor;
import com.coinchase.task.ProcessorTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One reusable session slot.
 *
 * A worker owns a fixed listening port for its whole life and is handed to
 * successive users by the {@link WorkerPool}. Each time it is armed it gets a
 * fresh {@link SessionTermination} shared by its receiver, its paired
 * processor task and (once WORKING) its sender, so that any one of them
 * failing tears the other two down.
 *
 * Thread Safety:
 * - Status, owner, address and the current session are guarded by the
 *   worker's own read/write lock
 * - Callers that also hold the pool lock always take it first
 */
public class Worker {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final int id;
    private final SessionReceiver receiver;
    private final EventProcessor processors;
    private final OwnerIndex owners;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();

    private WorkerStatus status = WorkerStatus.AVAILABLE;
    private String ownerUserId = "";
    private InetSocketAddress clientAddress;
    private SendRoutine sendRoutine;
    private SessionTermination termination;
    private ProcessorTask processorTask;
    private SessionSender sender;

    public Worker(int id, SessionReceiver receiver, EventProcessor processors, OwnerIndex owners) {
        this.id = id;
        this.receiver = receiver;
        this.processors = processors;
        this.owners = owners;
    }

    /**
     * Binds the listening port and launches the paired processor task.
     * Called once at startup; recycling re-arms the worker by itself.
     */
    public CompletableFuture<Integer> start() {
        rwLock.writeLock().lock();
        try {
            if (termination != null) {
                throw new IllegalStateException("Worker " + id + " already started");
            }
            return arm();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public void setSendRoutine(SendRoutine sendRoutine) {
        rwLock.writeLock().lock();
        try {
            this.sendRoutine = sendRoutine;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Binds the slot to a user and the address the client listens on for
     * snapshots. Only valid right after the slot was pulled out.
     *
     * @throws InvalidWorkerStateException    if the slot is not PULLED_OUT; the slot is force-exited
     * @throws UserAlreadyConnectedException if the user already owns another slot
     */
    public void setClientInformation(String userId, InetAddress clientIp, int clientPort) {
        rwLock.writeLock().lock();
        try {
            if (status != WorkerStatus.PULLED_OUT) {
                WorkerStatus actual = status;
                forceExitLocked("client information received while " + actual);
                throw new InvalidWorkerStateException(id, WorkerStatus.PULLED_OUT, actual);
            }
            if (!owners.claim(userId, id)) {
                throw new UserAlreadyConnectedException(userId);
            }

            ownerUserId = userId;
            clientAddress = new InetSocketAddress(clientIp, clientPort);
            status = WorkerStatus.INFO_RECEIVED;
            logger.info("Worker {} bound to user {} ({})", id, userId, clientAddress);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Starts pushing snapshots to the client. Moves the slot to WORKING.
     *
     * @throws InvalidWorkerStateException if the slot is not INFO_RECEIVED or has no
     *                                     send routine; the slot is force-exited
     */
    public void startSendUserRelatedDataToClient() {
        rwLock.writeLock().lock();
        try {
            if (status != WorkerStatus.INFO_RECEIVED) {
                WorkerStatus actual = status;
                forceExitLocked("send started while " + actual);
                throw new InvalidWorkerStateException(id, WorkerStatus.INFO_RECEIVED, actual);
            }
            if (sendRoutine == null) {
                forceExitLocked("no send routine registered");
                throw new InvalidWorkerStateException(id, "no send routine registered");
            }

            status = WorkerStatus.WORKING;
            SessionTermination session = termination;
            SessionSender started = sendRoutine.start(ownerUserId, clientAddress, session);
            sender = started;
            session.onTermination(started::stop);
            receiver.admit(session);
            logger.info("Worker {} sending to {} at {}", id, ownerUserId, clientAddress);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Tears the current session down as an unrecoverable failure.
     */
    public void forceExit(String reason) {
        rwLock.readLock().lock();
        try {
            forceExitLocked(reason);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * Probes the receiver and the paired processor; completes once both echo.
     */
    public CompletableFuture<Void> ping() {
        SessionReceiver currentReceiver;
        ProcessorTask task;
        rwLock.readLock().lock();
        try {
            currentReceiver = receiver;
            task = processorTask;
        } finally {
            rwLock.readLock().unlock();
        }
        return CompletableFuture.allOf(currentReceiver.ping(), task.ping());
    }

    /**
     * Marks the slot TERMINATED on behalf of the given session. Ignored if the
     * slot has since been recycled into a newer session, or if it is not in
     * use: an AVAILABLE slot stays in the pool and its idle session is
     * replaced when it is next pulled out.
     */
    public void markTerminated(SessionTermination session) {
        rwLock.writeLock().lock();
        try {
            if (session == termination && status.isInUse()) {
                logger.info("Worker {} terminated (was {}, owner '{}')", id, status, ownerUserId);
                status = WorkerStatus.TERMINATED;
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * AVAILABLE → PULLED_OUT, with a fresh session if the idle one has
     * ended. Only the pool calls this, under its lock.
     */
    boolean pullOut() {
        rwLock.writeLock().lock();
        try {
            if (status != WorkerStatus.AVAILABLE) {
                return false;
            }
            if (termination.isTerminated()) {
                logger.info("Worker {} idle session ended ({}), re-arming", id, termination.getReason());
                arm();
            }
            status = WorkerStatus.PULLED_OUT;
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Ends whatever session the slot carries and makes it AVAILABLE again
     * with a fresh session. Only the pool calls this, under its lock.
     *
     * @return false if the slot was already AVAILABLE
     */
    boolean recycle(String reason) {
        rwLock.writeLock().lock();
        try {
            if (status == WorkerStatus.AVAILABLE) {
                return false;
            }

            if (sender != null) {
                sender.stop();
                sender = null;
            }
            termination.terminate(reason);

            if (!ownerUserId.isEmpty()) {
                owners.release(ownerUserId, id);
            }
            logger.info("Worker {} recycled from {} (owner '{}'): {}", id, status, ownerUserId, reason);
            ownerUserId = "";
            clientAddress = null;
            status = WorkerStatus.AVAILABLE;

            arm();
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    void shutdown() {
        rwLock.writeLock().lock();
        try {
            if (sender != null) {
                sender.stop();
                sender = null;
            }
            if (termination != null) {
                termination.terminate("server shutdown");
            }
            receiver.close();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    // Caller holds the write lock.
    private CompletableFuture<Integer> arm() {
        SessionTermination session = new SessionTermination("worker-" + id);
        ProcessorTask task = processors.launch(this, session);
        session.onTermination(() -> task.signalTermination(session.isForced()));

        termination = session;
        processorTask = task;
        return receiver.open(session);
    }

    private void forceExitLocked(String reason) {
        if (termination != null) {
            termination.forceExit(reason);
        }
    }

    public int getId() {
        return id;
    }

    public int getPort() {
        return receiver.port();
    }

    public WorkerStatus getStatus() {
        rwLock.readLock().lock();
        try {
            return status;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public String getOwnerUserId() {
        rwLock.readLock().lock();
        try {
            return ownerUserId;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public InetSocketAddress getClientAddress() {
        rwLock.readLock().lock();
        try {
            return clientAddress;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public SessionTermination getTermination() {
        rwLock.readLock().lock();
        try {
            return termination;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "Worker{" +
                "id=" + id +
                ", port=" + getPort() +
                ", status=" + getStatus() +
                ", owner='" + getOwnerUserId() + '\'' +
                '}';
    }
}
