package com.coinchase.protocol;

import com.coinchase.state.Position;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The per-tick snapshot pushed to one client.
 *
 * Built fresh on every broadcast tick and never modified afterwards, so it
 * can be handed to the channel without copying.
 *
 * JSON format:
 * {
 *     "userPosition": {"x": 3, "y": 4},
 *     "relatedPositions": [{"cell": {...}, "position": {...}}, ...],
 *     "scoreboard": {"user-1": 2, "user-2": 0}
 * }
 */
public final class RelatedPositionsMessage {

    private final Position userPosition;
    private final List<RelatedPositionView> relatedPositions;
    private final Map<String, Integer> scoreboard;

    @JsonCreator
    public RelatedPositionsMessage(@JsonProperty("userPosition") Position userPosition,
                                   @JsonProperty("relatedPositions") List<RelatedPositionView> relatedPositions,
                                   @JsonProperty("scoreboard") Map<String, Integer> scoreboard) {
        this.userPosition = userPosition;
        this.relatedPositions = relatedPositions == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(relatedPositions);
        this.scoreboard = scoreboard == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(scoreboard);
    }

    public Position getUserPosition() {
        return userPosition;
    }

    public List<RelatedPositionView> getRelatedPositions() {
        return relatedPositions;
    }

    public Map<String, Integer> getScoreboard() {
        return scoreboard;
    }

    @Override
    public String toString() {
        return "RelatedPositionsMessage{" +
                "userPosition=" + userPosition +
                ", relatedPositions=" + relatedPositions.size() +
                ", scoreboard=" + scoreboard +
                '}';
    }
}
