package com.coinchase.state;

/**
 * A cell together with where it is, as seen from one user's viewpoint.
 */
public final class RelatedPosition {

    private final Cell cell;
    private final Position position;

    public RelatedPosition(Cell cell, Position position) {
        this.cell = cell;
        this.position = position;
    }

    public Cell getCell() {
        return cell;
    }

    public Position getPosition() {
        return position;
    }
}
