package com.coinchase.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Shared tick driving every sender. Each tick runs every subscriber once;
 * a subscriber that throws is logged and stays subscribed.
 */
public class BroadcastClock {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastClock.class);

    private final ScheduledExecutorService scheduler;
    private final long intervalMillis;
    private final Set<Runnable> subscribers = new CopyOnWriteArraySet<>();

    private ScheduledFuture<?> ticking;

    public BroadcastClock(ScheduledExecutorService scheduler, long intervalMillis) {
        this.scheduler = scheduler;
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (ticking == null) {
            ticking = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            logger.info("Broadcast clock ticking every {}ms", intervalMillis);
        }
    }

    public synchronized void stop() {
        if (ticking != null) {
            ticking.cancel(false);
            ticking = null;
        }
    }

    public void subscribe(Runnable subscriber) {
        subscribers.add(subscriber);
    }

    public void unsubscribe(Runnable subscriber) {
        subscribers.remove(subscriber);
    }

    public void tick() {
        for (Runnable subscriber : subscribers) {
            try {
                subscriber.run();
            } catch (RuntimeException e) {
                logger.error("Broadcast subscriber failed", e);
            }
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }
}
