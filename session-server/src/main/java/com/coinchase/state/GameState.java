package com.coinchase.state;

import com.coinchase.protocol.AttackEvent;
import com.coinchase.protocol.StatusEvent;

import java.util.List;

/**
 * Shared game state as seen by the session core.
 *
 * Implementations must tolerate concurrent calls: the processor pool
 * mutates through {@link #updateUserPosition} and {@link #applyAttack} while
 * every sender reads through {@link #getRelatedPositions} on each tick.
 */
public interface GameState {

    void updateUserPosition(StatusEvent status);

    void applyAttack(AttackEvent attack);

    /**
     * Returns the cells visible from {@code position}, widened by
     * {@code visibilityModifier} cells in every direction.
     */
    List<RelatedPosition> getRelatedPositions(Position position, int visibilityModifier);

    void removeUser(String userId);

    int getCoinCount();

    int getItemCount();
}
