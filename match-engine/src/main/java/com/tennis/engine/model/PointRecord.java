package com.tennis.engine.model;

import com.tennis.engine.event.PointEvent;

/**
 * One resolved point, as it appears in the point-by-point log. The four pressure flags describe
 * the score before the point was played.
 *
 * @param setIndex    zero-based set index
 * @param gameIndex   zero-based game index within the set (games already completed)
 * @param tiebreak    whether the point was played in a set or match tiebreak
 * @param pointNumber one-based number of the point within its game or tiebreak
 */
public record PointRecord(
        int setIndex,
        int gameIndex,
        boolean tiebreak,
        int pointNumber,
        Player server,
        ServeType serveType,
        PointEvent event,
        Player winner,
        boolean breakPoint,
        boolean gamePoint,
        boolean setPoint,
        boolean matchPoint
) {

    /**
     * Pressure tags in log order, e.g. {@code "BP GP"}; empty when none applied.
     */
    public String pressureTags() {
        StringBuilder sb = new StringBuilder();
        if (breakPoint) sb.append("BP ");
        if (gamePoint) sb.append("GP ");
        if (setPoint) sb.append("SP ");
        if (matchPoint) sb.append("MP ");
        return sb.toString().trim();
    }
}
