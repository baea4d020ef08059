package com.coinchase.protocol;

import com.coinchase.state.GameState;
import com.coinchase.state.Position;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Status frame: where the user currently stands.
 *
 * JSON format: {"id": "user-1", "currentPosition": {"x": 3, "y": 4}}
 */
public final class StatusEvent implements InboundEvent {

    private final String userId;
    private final Position currentPosition;

    @JsonCreator
    public StatusEvent(@JsonProperty("id") String userId,
                       @JsonProperty("currentPosition") Position currentPosition) {
        this.userId = Objects.requireNonNull(userId, "id");
        this.currentPosition = Objects.requireNonNull(currentPosition, "currentPosition");
    }

    @Override
    public PacketType type() {
        return PacketType.STATUS;
    }

    @Override
    @JsonProperty("id")
    public String getUserId() {
        return userId;
    }

    public Position getCurrentPosition() {
        return currentPosition;
    }

    @Override
    public void applyTo(GameState gameState) {
        gameState.updateUserPosition(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatusEvent)) {
            return false;
        }
        StatusEvent that = (StatusEvent) o;
        return userId.equals(that.userId) && currentPosition.equals(that.currentPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, currentPosition);
    }

    @Override
    public String toString() {
        return "StatusEvent{" +
                "userId='" + userId + '\'' +
                ", currentPosition=" + currentPosition +
                '}';
    }
}
