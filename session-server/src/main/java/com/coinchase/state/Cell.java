package com.coinchase.state;

/**
 * Snapshot of one map cell.
 *
 * Cells are replaced rather than mutated, so a copy handed to a sender
 * never changes underneath it.
 */
public final class Cell {

    public static final Cell EMPTY_GROUND = new Cell(false, "", CellKind.GROUND);

    private final boolean occupied;
    private final String owner;
    private final CellKind kind;

    public Cell(boolean occupied, String owner, CellKind kind) {
        this.occupied = occupied;
        this.owner = owner == null ? "" : owner;
        this.kind = kind;
    }

    public boolean isOccupied() {
        return occupied;
    }

    public String getOwner() {
        return owner;
    }

    public CellKind getKind() {
        return kind;
    }

    public Cell occupiedBy(String userId) {
        return new Cell(true, userId, kind);
    }

    public Cell vacated() {
        return new Cell(false, "", kind);
    }

    public Cell withKind(CellKind newKind) {
        return new Cell(occupied, owner, newKind);
    }

    @Override
    public String toString() {
        return "Cell{" +
                "occupied=" + occupied +
                ", owner='" + owner + '\'' +
                ", kind=" + kind +
                '}';
    }
}
