package com.coinchase.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation shared by the receiver, sender and processor of one session.
 *
 * Firing is idempotent: the first call wins, records its reason and runs
 * every registered listener once. Listeners registered after firing run
 * immediately on the registering thread. A listener must only release its
 * own resources (close channels, raise flags); it must not block.
 *
 * A forced exit is a termination that also marks an unrecoverable local
 * invariant violation, so observers can tell it apart from an ordinary stop.
 */
public class SessionTermination {

    private static final Logger logger = LoggerFactory.getLogger(SessionTermination.class);

    private final String name;
    private final CountDownLatch terminated = new CountDownLatch(1);

    // Guarded by this
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean fired;

    private volatile boolean forced;
    private volatile String reason;
    private volatile Throwable cause;

    public SessionTermination(String name) {
        this.name = name;
    }

    public boolean terminate(String reason) {
        return fire(reason, null, false);
    }

    public boolean terminate(String reason, Throwable cause) {
        return fire(reason, cause, false);
    }

    public boolean forceExit(String reason) {
        return fire(reason, null, true);
    }

    /**
     * Registers a listener to run when this session terminates.
     */
    public void onTermination(Runnable listener) {
        synchronized (this) {
            if (!fired) {
                listeners.add(listener);
                return;
            }
        }
        runSafely(listener);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    public boolean isForced() {
        return forced;
    }

    public String getReason() {
        return reason;
    }

    public Throwable getCause() {
        return cause;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public String getName() {
        return name;
    }

    private boolean fire(String reason, Throwable cause, boolean forced) {
        List<Runnable> toRun;
        synchronized (this) {
            if (fired) {
                return false;
            }
            fired = true;
            this.reason = reason;
            this.cause = cause;
            this.forced = forced;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        terminated.countDown();

        if (forced) {
            logger.warn("Session {} force-exited: {}", name, reason);
        } else if (cause != null) {
            logger.warn("Session {} terminated: {} ({})", name, reason, cause.toString());
        } else {
            logger.info("Session {} terminated: {}", name, reason);
        }

        for (Runnable listener : toRun) {
            runSafely(listener);
        }
        return true;
    }

    private void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.error("Termination listener failed in session {}", name, e);
        }
    }

    @Override
    public String toString() {
        return "SessionTermination{" +
                "name='" + name + '\'' +
                ", terminated=" + isTerminated() +
                ", forced=" + forced +
                ", reason='" + reason + '\'' +
                '}';
    }
}
