package com.coinchase.worker;

/**
 * Lifecycle of a worker slot.
 *
 * AVAILABLE → PULLED_OUT → INFO_RECEIVED → WORKING → TERMINATED → AVAILABLE
 *
 * A slot is never destroyed; putting it back to the pool always returns it
 * to AVAILABLE, from whichever state it was in.
 */
public enum WorkerStatus {
    AVAILABLE,
    PULLED_OUT,
    INFO_RECEIVED,
    WORKING,
    TERMINATED;

    /**
     * @return true while a session owns the slot and has not ended
     */
    public boolean isInUse() {
        return this == PULLED_OUT || this == INFO_RECEIVED || this == WORKING;
    }
}
