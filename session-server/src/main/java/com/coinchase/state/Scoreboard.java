package com.coinchase.state;

import java.util.Map;

public interface Scoreboard {

    /**
     * Adds the user with a score of zero, so they show up before scoring.
     */
    void register(String userId);

    void addScore(String userId, int delta);

    Map<String, Integer> getCopiedBoard();

    void removeUser(String userId);
}
