package com.coinchase.protocol;

import com.coinchase.state.GameState;

/**
 * A decoded client frame, consumed exactly once by the processor pool.
 */
public interface InboundEvent {

    PacketType type();

    String getUserId();

    void applyTo(GameState gameState);
}
