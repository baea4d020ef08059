package com.coinchase.state;

/**
 * What lies on a map cell. The ordinal is the value sent to clients.
 */
public enum CellKind {
    GROUND,
    COIN,
    ITEM;

    public int code() {
        return ordinal();
    }
}
