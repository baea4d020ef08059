package com.coinchase.worker;

public class UserAlreadyConnectedException extends WorkerPoolException {

    public UserAlreadyConnectedException(String userId) {
        super("User '" + userId + "' already owns a worker");
    }
}
