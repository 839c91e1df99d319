package com.tennis.tracker.dto;

import com.tennis.engine.event.ReturnOutcome;
import jakarta.validation.constraints.NotNull;

public record ReturnRequest(@NotNull ReturnOutcome outcome) {
}
