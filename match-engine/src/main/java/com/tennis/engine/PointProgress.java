package com.tennis.engine;

import com.tennis.engine.model.MatchPhase;
import com.tennis.engine.model.PointRecord;

/**
 * Result of one submission.
 *
 * @param nextStep what the controller expects next
 * @param resolved the point that was just recorded, or {@code null} if the point is still live
 * @param phase    phase after the submission; {@link MatchPhase#SET_COMPLETE} when this point
 *                 closed a set without ending the match
 */
public record PointProgress(PointStep nextStep, PointRecord resolved, MatchPhase phase) {

    public boolean isResolved() {
        return resolved != null;
    }
}
