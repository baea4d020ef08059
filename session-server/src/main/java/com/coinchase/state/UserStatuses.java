package com.coinchase.state;

/**
 * Registry of the latest status per connected user.
 */
public interface UserStatuses {

    /**
     * @return the user's status, or null if the user is not (or no longer) on the map
     */
    UserStatus getUserStatus(String userId);

    void putUserStatus(UserStatus status);

    void removeUser(String userId);
}
