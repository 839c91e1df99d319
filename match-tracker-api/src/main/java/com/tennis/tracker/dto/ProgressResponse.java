package com.tennis.tracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tennis.engine.PointProgress;
import com.tennis.engine.PointStep;
import com.tennis.engine.Scoreboard;
import com.tennis.engine.model.MatchPhase;

import java.util.List;

/**
 * Outcome of a point submission.
 *
 * @param point the point just decided, absent while the point is still live
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressResponse(
        PointStep nextStep,
        List<String> accepted,
        MatchPhase phase,
        PointResponse point,
        Scoreboard scoreboard
) {
    public static ProgressResponse from(PointProgress progress, int logSize, Scoreboard scoreboard) {
        PointResponse point = progress.isResolved() ? PointResponse.from(progress.resolved(), logSize) : null;
        return new ProgressResponse(
                progress.nextStep(),
                progress.nextStep().acceptedOutcomes(),
                progress.phase(),
                point,
                scoreboard
        );
    }
}
