package com.coinchase.protocol;

import com.coinchase.state.Cell;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire form of a map cell: {"occupied": true, "owner": "user-1", "kind": 0}
 */
public final class CellView {

    private final boolean occupied;
    private final String owner;
    private final int kind;

    @JsonCreator
    public CellView(@JsonProperty("occupied") boolean occupied,
                    @JsonProperty("owner") String owner,
                    @JsonProperty("kind") int kind) {
        this.occupied = occupied;
        this.owner = owner;
        this.kind = kind;
    }

    public static CellView of(Cell cell) {
        return new CellView(cell.isOccupied(), cell.getOwner(), cell.getKind().code());
    }

    public boolean isOccupied() {
        return occupied;
    }

    public String getOwner() {
        return owner;
    }

    public int getKind() {
        return kind;
    }
}
