package com.tennis.engine;

import com.tennis.engine.model.PointRecord;

/**
 * Callbacks for collaborators that want to react to the match as it is scored. Notifications
 * never influence the score.
 */
public interface MatchListener {

    MatchListener NONE = new MatchListener() {};

    /**
     * Players change ends before the next tiebreak point.
     *
     * @param tiebreakPointsPlayed tiebreak points played so far
     */
    default void onEndChange(int tiebreakPointsPlayed) {}

    default void onPointRecorded(PointRecord record) {}

    default void onMatchComplete() {}
}
