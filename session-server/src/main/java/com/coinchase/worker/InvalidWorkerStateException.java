package com.coinchase.worker;

/**
 * An operation was invoked out of the slot's lifecycle order. The slot has
 * already been force-exited by the time this is thrown.
 */
public class InvalidWorkerStateException extends WorkerPoolException {

    public InvalidWorkerStateException(int workerId, WorkerStatus expected, WorkerStatus actual) {
        super("Invalid status change on worker " + workerId
                + ": expected " + expected + " but was " + actual);
    }

    public InvalidWorkerStateException(int workerId, String message) {
        super("Invalid status change on worker " + workerId + ": " + message);
    }
}
