package com.coinchase.worker;

import java.net.InetSocketAddress;

/**
 * Starts pushing snapshots to a client. Registered on every slot before
 * the slot can enter WORKING.
 */
@FunctionalInterface
public interface SendRoutine {

    SessionSender start(String userId, InetSocketAddress clientAddress, SessionTermination termination);
}
