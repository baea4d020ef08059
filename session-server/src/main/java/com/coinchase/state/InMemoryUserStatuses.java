package com.coinchase.state;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ConcurrentHashMap-backed user registry. Each user has a single writer
 * at a time (its own processor event), readers never block.
 */
public class InMemoryUserStatuses implements UserStatuses {

    private final Map<String, UserStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public UserStatus getUserStatus(String userId) {
        return statuses.get(userId);
    }

    @Override
    public void putUserStatus(UserStatus status) {
        statuses.put(status.getUserId(), status);
    }

    @Override
    public void removeUser(String userId) {
        statuses.remove(userId);
    }
}
