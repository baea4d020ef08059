package com.coinchase.protocol;

import com.coinchase.state.GameState;
import com.coinchase.state.RelatedPosition;
import com.coinchase.state.Scoreboard;
import com.coinchase.state.UserStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a user's snapshot from the shared game state: own position, the
 * visible cells around it and a copy of the scoreboard.
 */
public class SnapshotAssembler {

    private final GameState gameState;
    private final Scoreboard scoreboard;

    public SnapshotAssembler(GameState gameState, Scoreboard scoreboard) {
        this.gameState = gameState;
        this.scoreboard = scoreboard;
    }

    public RelatedPositionsMessage assemble(UserStatus userStatus) {
        List<RelatedPosition> related = gameState.getRelatedPositions(
                userStatus.getPosition(), userStatus.getItemEffect());

        List<RelatedPositionView> views = new ArrayList<>(related.size());
        for (RelatedPosition relatedPosition : related) {
            views.add(new RelatedPositionView(
                    CellView.of(relatedPosition.getCell()),
                    relatedPosition.getPosition()));
        }

        return new RelatedPositionsMessage(userStatus.getPosition(), views, scoreboard.getCopiedBoard());
    }
}
