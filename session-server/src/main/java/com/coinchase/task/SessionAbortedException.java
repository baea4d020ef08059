package com.coinchase.task;

/**
 * Raised inside a processor task when its session was force-exited.
 */
public class SessionAbortedException extends RuntimeException {

    public SessionAbortedException(String message) {
        super(message);
    }
}
