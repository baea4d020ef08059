package com.coinchase.protocol;

import com.coinchase.state.GameState;
import com.coinchase.state.Position;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Attack frame.
 *
 * JSON format: {"userId": "user-1", "userPosition": {...}, "attackPosition": {...}}
 */
public final class AttackEvent implements InboundEvent {

    private final String userId;
    private final Position userPosition;
    private final Position attackPosition;

    @JsonCreator
    public AttackEvent(@JsonProperty("userId") String userId,
                       @JsonProperty("userPosition") Position userPosition,
                       @JsonProperty("attackPosition") Position attackPosition) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.userPosition = Objects.requireNonNull(userPosition, "userPosition");
        this.attackPosition = Objects.requireNonNull(attackPosition, "attackPosition");
    }

    @Override
    public PacketType type() {
        return PacketType.ATTACK;
    }

    @Override
    public String getUserId() {
        return userId;
    }

    public Position getUserPosition() {
        return userPosition;
    }

    public Position getAttackPosition() {
        return attackPosition;
    }

    @Override
    public void applyTo(GameState gameState) {
        gameState.applyAttack(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttackEvent)) {
            return false;
        }
        AttackEvent that = (AttackEvent) o;
        return userId.equals(that.userId)
                && userPosition.equals(that.userPosition)
                && attackPosition.equals(that.attackPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, userPosition, attackPosition);
    }

    @Override
    public String toString() {
        return "AttackEvent{" +
                "userId='" + userId + '\'' +
                ", userPosition=" + userPosition +
                ", attackPosition=" + attackPosition +
                '}';
    }
}
