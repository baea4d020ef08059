package com.coinchase.worker;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * userId → worker id. Guarantees a user owns at most one slot.
 *
 * Lock-free so slots can claim under their own lock without ever taking
 * the pool lock (the pool always locks pool → slot, never the reverse).
 */
public class OwnerIndex {

    private final Map<String, Integer> owners = new ConcurrentHashMap<>();

    /**
     * @return true if the user now owns {@code workerId}, false if another slot has them
     */
    public boolean claim(String userId, int workerId) {
        Integer existing = owners.putIfAbsent(userId, workerId);
        return existing == null || existing == workerId;
    }

    public void release(String userId, int workerId) {
        owners.remove(userId, workerId);
    }

    /**
     * @return the worker id owned by the user, or null
     */
    public Integer find(String userId) {
        return owners.get(userId);
    }
}
