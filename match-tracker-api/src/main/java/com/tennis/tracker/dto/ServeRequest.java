package com.tennis.tracker.dto;

import com.tennis.engine.event.ServeOutcome;
import jakarta.validation.constraints.NotNull;

public record ServeRequest(@NotNull ServeOutcome outcome) {
}
