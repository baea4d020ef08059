package com.coinchase.worker;

public class WorkerNotFoundException extends WorkerPoolException {

    public WorkerNotFoundException(String userId) {
        super("No worker bound to user '" + userId + "'");
    }
}
