package com.coinchase.worker;

/**
 * Every slot is in use. Callers reject the request; nothing is retried.
 */
public class WorkerCapacityException extends WorkerPoolException {

    public WorkerCapacityException(int capacity) {
        super("No worker available (capacity " + capacity + ")");
    }
}
