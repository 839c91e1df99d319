package com.tennis.tracker.dto;

import com.tennis.engine.model.Player;
import jakarta.validation.constraints.NotNull;

public record TiebreakServerRequest(@NotNull Player server) {
}
