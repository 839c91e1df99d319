package com.tennis.tracker.dto;

import com.tennis.engine.PointStep;
import com.tennis.engine.model.Player;

import java.util.List;

public record StatusResponse(
        boolean matchComplete,
        boolean setTiebreak,
        boolean matchTiebreak,
        boolean pointInProgress,
        PointStep pendingStep,
        List<String> accepted,
        int undoDepth,
        Player winner
) {
}
