package com.coinchase.worker;

/**
 * Handle on a running outbound sender.
 */
public interface SessionSender {

    /**
     * Stops sending without failing the session. Idempotent.
     */
    void stop();
}
