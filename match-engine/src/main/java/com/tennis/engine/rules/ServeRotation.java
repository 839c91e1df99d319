package com.tennis.engine.rules;

import com.tennis.engine.model.Player;

/**
 * Tiebreak serving order. The starting server serves one point, then the players alternate
 * every two points: S, O, O, S, S, O, O, S, ...
 */
public final class ServeRotation {

    /**
     * Players change ends after every this many tiebreak points.
     */
    public static final int END_CHANGE_INTERVAL = 6;

    private ServeRotation() {}

    /**
     * Server of the next tiebreak point.
     *
     * @param startingServer player who served the first point of the tiebreak
     * @param pointsPlayed   tiebreak points already played
     */
    public static Player serverFor(Player startingServer, int pointsPlayed) {
        if (pointsPlayed < 0) {
            throw new IllegalArgumentException("pointsPlayed must be >= 0: " + pointsPlayed);
        }
        int slot = pointsPlayed % 4;
        return (slot == 0 || slot == 3) ? startingServer : startingServer.opponent();
    }

    /**
     * Whether the players change ends before the next point.
     */
    public static boolean isEndChange(int pointsPlayed) {
        return pointsPlayed > 0 && pointsPlayed % END_CHANGE_INTERVAL == 0;
    }
}
