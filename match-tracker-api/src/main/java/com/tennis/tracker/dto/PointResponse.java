package com.tennis.tracker.dto;

import com.tennis.engine.model.Player;
import com.tennis.engine.model.PointRecord;
import com.tennis.engine.model.ServeType;
import com.tennis.tracker.export.EventDescriber;

/**
 * One line of the point log. Set and game numbers are 1-based.
 */
public record PointResponse(
        int index,
        int set,
        int game,
        boolean tiebreak,
        int pointInGame,
        Player server,
        ServeType serveType,
        Player winner,
        boolean breakPoint,
        boolean gamePoint,
        boolean setPoint,
        boolean matchPoint,
        Player netPlayer,
        String event
) {
    public static PointResponse from(PointRecord record, int index) {
        return new PointResponse(
                index,
                record.setIndex() + 1,
                record.gameIndex() + 1,
                record.tiebreak(),
                record.pointNumber(),
                record.server(),
                record.serveType(),
                record.winner(),
                record.breakPoint(),
                record.gamePoint(),
                record.setPoint(),
                record.matchPoint(),
                record.event().netPlayer(),
                EventDescriber.describe(record.event())
        );
    }
}
