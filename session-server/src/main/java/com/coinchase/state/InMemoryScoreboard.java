package com.coinchase.state;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores per user. Scores never go below zero.
 */
public class InMemoryScoreboard implements Scoreboard {

    private final ConcurrentHashMap<String, Integer> board = new ConcurrentHashMap<>();

    @Override
    public void register(String userId) {
        board.putIfAbsent(userId, 0);
    }

    @Override
    public void addScore(String userId, int delta) {
        board.merge(userId, Math.max(0, delta), (current, ignored) -> Math.max(0, current + delta));
    }

    /**
     * Moves one point from {@code from} to {@code to} if {@code from} has any.
     *
     * @return true if a point was moved
     */
    public synchronized boolean takePoint(String from, String to) {
        Integer victimScore = board.get(from);
        if (victimScore == null || victimScore <= 0) {
            return false;
        }
        board.put(from, victimScore - 1);
        board.merge(to, 1, Integer::sum);
        return true;
    }

    public int getScore(String userId) {
        return board.getOrDefault(userId, 0);
    }

    /**
     * Returns a copy that callers may serialize while scores keep changing.
     */
    @Override
    public Map<String, Integer> getCopiedBoard() {
        return new HashMap<>(board);
    }

    @Override
    public void removeUser(String userId) {
        board.remove(userId);
    }
}
