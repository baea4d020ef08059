package com.coinchase.worker;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound side of a slot: owns the slot's listening port.
 */
public interface SessionReceiver {

    /**
     * Arms the receiver for a new session. The port is bound on first use
     * and kept for later sessions; a connection left over from the previous
     * session is closed. Never blocks; the future completes with the bound
     * port. Clients are refused until the session is admitted.
     */
    CompletableFuture<Integer> open(SessionTermination termination);

    /**
     * Lets the client of {@code termination} connect. Ignored unless it is
     * the session last opened. The connection is closed when the session
     * terminates.
     */
    void admit(SessionTermination termination);

    /**
     * Completes once the receiver's I/O loop has run the probe.
     */
    CompletableFuture<Void> ping();

    int port();

    /**
     * Releases the port for good.
     */
    void close();
}
