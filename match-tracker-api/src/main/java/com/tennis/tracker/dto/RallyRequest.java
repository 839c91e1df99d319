package com.tennis.tracker.dto;

import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.model.Player;
import jakarta.validation.constraints.NotNull;

/**
 * @param netPlayer player who came to the net on this point, if any
 */
public record RallyRequest(@NotNull RallyOutcome outcome, Player netPlayer) {
}
