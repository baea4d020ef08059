package com.coinchase.protocol;

import com.coinchase.state.Position;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class RelatedPositionView {

    private final CellView cell;
    private final Position position;

    @JsonCreator
    public RelatedPositionView(@JsonProperty("cell") CellView cell,
                               @JsonProperty("position") Position position) {
        this.cell = cell;
        this.position = position;
    }

    public CellView getCell() {
        return cell;
    }

    public Position getPosition() {
        return position;
    }
}
