package com.coinchase.state;

/**
 * Latest known state of a connected user.
 *
 * Immutable: every update produces a new instance, and the previous one
 * is simply dropped (last write wins).
 */
public final class UserStatus {

    private final String userId;
    private final Position position;
    private final int itemEffect;
    private final long lastUpdateTime;

    public UserStatus(String userId, Position position, int itemEffect) {
        this.userId = userId;
        this.position = position;
        this.itemEffect = itemEffect;
        this.lastUpdateTime = System.currentTimeMillis();
    }

    public String getUserId() {
        return userId;
    }

    public Position getPosition() {
        return position;
    }

    /**
     * Extra visibility radius granted by picked-up items.
     */
    public int getItemEffect() {
        return itemEffect;
    }

    public long getLastUpdateTime() {
        return lastUpdateTime;
    }

    public UserStatus withPosition(Position newPosition) {
        return new UserStatus(userId, newPosition, itemEffect);
    }

    public UserStatus withItemEffect(int newItemEffect) {
        return new UserStatus(userId, position, newItemEffect);
    }

    @Override
    public String toString() {
        return "UserStatus{" +
                "userId='" + userId + '\'' +
                ", position=" + position +
                ", itemEffect=" + itemEffect +
                '}';
    }
}
