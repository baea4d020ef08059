package com.coinchase.worker;

/**
 * Base class for everything the pool and its slots reject.
 */
public class WorkerPoolException extends RuntimeException {

    public WorkerPoolException(String message) {
        super(message);
    }
}
